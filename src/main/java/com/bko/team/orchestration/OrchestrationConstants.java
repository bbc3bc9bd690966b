package com.bko.team.orchestration;

import java.util.List;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    public static final String CONTEXT_SEPARATOR = "\n\nCONTEXT:\n";

    // Default texts
    public static final String DEFAULT_CONSTRAINTS = "Use standard technologies and stay consistent with the other components.";
    public static final String DEFAULT_SUCCESS_CRITERIA = "A working, well documented and maintainable solution.";
    public static final String NO_SOLUTION_PRODUCED = "No solution could be produced for this task.";

    public static final String DEFAULT_FUNCTIONAL_REQUIREMENTS = "Requirements derived from the task.";
    public static final String DEFAULT_NON_FUNCTIONAL_REQUIREMENTS = "Performance, security and maintainability.";
    public static final String DEFAULT_DATA_MODEL = "Data model derived from the task requirements.";
    public static final String DEFAULT_API_CONSTRAINTS = "Follow REST conventions, keep the API secure and optimise performance.";
    public static final List<String> DEFAULT_ENDPOINTS = List.of(
            "GET /api/{resource}",
            "POST /api/{resource}",
            "PUT /api/{resource}/{id}",
            "DELETE /api/{resource}/{id}");
    public static final String DEFAULT_API_NAME = "API";

    public static final String DEFAULT_TARGET_USERS = "General users of the application.";
    public static final String DEFAULT_REQUIRED_FEATURES = "Core features required by the task.";
    public static final String DEFAULT_BACKEND_INTEGRATION = "Use standard REST APIs for the integration.";
    public static final String DEFAULT_TECHNOLOGIES = "HTML, CSS, JavaScript and a modern framework such as React, Vue or Angular.";
    public static final String DEFAULT_COMPONENT_NAME = "Component";

    // Section markers, English first
    public static final List<String> FUNCTIONAL_MARKERS = List.of("FUNCTIONAL REQUIREMENTS", "EXIGENCES FONCTIONNELLES");
    public static final List<String> NON_FUNCTIONAL_MARKERS = List.of("NON-FUNCTIONAL REQUIREMENTS", "EXIGENCES NON-FONCTIONNELLES");
    public static final List<String> ENDPOINT_MARKERS = List.of("ENDPOINTS");
    public static final List<String> DATA_MODEL_MARKERS = List.of("DATA MODEL", "MODÈLE DE DONNÉES");
    public static final List<String> TARGET_USERS_MARKERS = List.of("TARGET USERS", "UTILISATEURS CIBLES");
    public static final List<String> REQUIRED_FEATURES_MARKERS = List.of("REQUIRED FEATURES", "FONCTIONNALITÉS REQUISES");
    public static final List<String> SPECIFICATIONS_MARKERS = List.of("SPECIFICATIONS", "SPÉCIFICATIONS");
    public static final List<String> TECHNOLOGIES_MARKERS = List.of("TECHNOLOGIES");

    // Classification keywords
    public static final List<String> FRONTEND_DESIGN_KEYWORDS = List.of("design", "ui", "ux");
    public static final List<String> FRONTEND_IMPLEMENTATION_KEYWORDS = List.of("implementation", "component");
    public static final List<String> BACKEND_DESIGN_KEYWORDS = List.of("architecture", "design");
    public static final List<String> BACKEND_IMPLEMENTATION_KEYWORDS = List.of("implementation", "api");

    // Coordinator prompts
    public static final String TASK_ANALYSIS_PROMPT = """
            As technical lead, analyse the following task and break it down into sub-tasks.

            TASK: {task}

            1. Analyse the main requirements.
            2. Identify the key components needed.
            3. Split the work between the frontend and the backend developer.
            4. Define the interfaces between the components.
            5. Set the success criteria of each sub-task.
            """;

    public static final String SUBTASK_EXTRACTION_PROMPT = """
            From your previous analysis of the task "{task}", extract:

            1. A list of specific tasks for the frontend developer (3 to 5 tasks).
            2. A list of specific tasks for the backend developer (3 to 5 tasks).
            3. The critical integration points between frontend and backend.

            Answer with strict JSON only, using the keys frontend_tasks, backend_tasks and integration_points,
            each holding a list of strings. If the task is too simple to be broken down, return empty lists.
            """;

    public static final String TASK_ASSIGNMENT_PROMPT = """
            Task assignment for {developerName}:

            PROJECT CONTEXT: {projectContext}

            YOUR TASK: {specificTask}

            EXPECTATIONS:
            - Deliver a working solution for the assigned task
            - Document your approach and technical decisions
            - Point out possible future improvements

            CONSTRAINTS:
            {constraints}

            INTERFACES WITH OTHER COMPONENTS:
            {interfaces}

            SUCCESS CRITERIA:
            {successCriteria}
            """;

    public static final String REVIEW_PROMPT = """
            Review of the work submitted by {developerName}:

            ORIGINAL TASK: {originalTask}

            SUBMITTED SOLUTION:
            {submittedSolution}

            Evaluate this solution against the following criteria:
            1. Functionality: does the solution meet the requirements?
            2. Quality: is the code or design clean and maintainable?
            3. Integration: how does it fit with the other components?
            4. Improvements: what would you suggest?
            """;

    public static final String INTEGRATION_PROMPT = """
            Integration of the components for the task: {task}

            FRONTEND COMPONENT:
            {frontendSolution}

            BACKEND COMPONENT:
            {backendSolution}

            Integrate the components, paying attention to:
            1. Consistency of the interfaces
            2. Compatibility of the exchanged data
            3. Communication flows between the components
            4. Potential integration problems and their solutions
            """;

    public static final String COMPLETE_SOLUTION_PROMPT = """
            Write a complete solution for the following task:

            {task}

            Cover both the frontend and the backend aspects in your solution.
            """;

    public static final String DIRECT_SOLUTION_PROMPT = """
            No sub-task was identified for this task.
            Please provide a complete solution for the following task:

            {task}

            Cover both the frontend and the backend aspects in your solution.
            Include code examples where relevant.
            """;

    // Worker prompts
    public static final String FRONTEND_CLASSIFICATION_PROMPT = """
            Analyse this task and decide whether it is mainly about:
            1. User interface design (UI/UX design)
            2. Implementation of a specific component or feature
            3. Both

            TASK:
            {assignment}

            Answer with a single digit only: 1, 2 or 3.
            """;

    public static final String BACKEND_CLASSIFICATION_PROMPT = """
            Analyse this task and decide whether it is mainly about:
            1. Backend architecture design
            2. Implementation of an API or specific components
            3. Both

            TASK:
            {assignment}

            Answer with a single digit only: 1, 2 or 3.
            """;

    public static final String FRONTEND_DESIGN_EXTRACTION_PROMPT = """
            From the following task, extract the target users and the required features:

            {assignment}

            Format your answer in two clearly separated sections:

            TARGET USERS:
            - (list of users)

            REQUIRED FEATURES:
            - (list of features)
            """;

    public static final String UI_DESIGN_PROMPT = """
            Design a user interface for: {feature}

            CONTEXT:
            {context}

            TARGET USERS:
            {targetUsers}

            REQUIRED FEATURES:
            {requiredFeatures}

            Provide:
            1. A description of the interface and its structure
            2. The UI components needed
            3. The main user interactions
            4. User experience considerations
            """;

    public static final String COMPONENT_EXTRACTION_PROMPT = """
            From the following task, extract the component specifications and the recommended technologies:

            {assignment}

            Format your answer in two sections:

            SPECIFICATIONS:
            - (list of specifications)

            TECHNOLOGIES:
            (recommended technologies)
            """;

    public static final String COMPONENT_IMPLEMENTATION_PROMPT = """
            Implement a frontend component for: {componentName}

            SPECIFICATIONS:
            {specifications}

            BACKEND INTEGRATION:
            {backendIntegration}

            RECOMMENDED TECHNOLOGIES:
            {recommendedTechnologies}

            Provide:
            1. The component code
            2. An explanation of the implementation choices
            3. Usage instructions
            4. Suggested tests
            """;

    public static final String FRONTEND_MIXED_PROMPT = """
            As frontend developer, complete the following task with every necessary detail:

            {assignment}

            Provide a complete solution that includes:
            1. The user interface design
            2. The technical implementation with the necessary code
            3. The reasons behind your design and implementation choices
            4. Integration instructions for the backend
            """;

    public static final String BACKEND_REQUIREMENTS_EXTRACTION_PROMPT = """
            From the following task, extract the functional and non-functional requirements:

            {assignment}

            Format your answer in two clearly separated sections:

            FUNCTIONAL REQUIREMENTS:
            - (list of requirements)

            NON-FUNCTIONAL REQUIREMENTS:
            - (list of requirements)
            """;

    public static final String ARCHITECTURE_DESIGN_PROMPT = """
            Design a backend architecture for: {feature}

            CONTEXT:
            {context}

            FUNCTIONAL REQUIREMENTS:
            {functionalRequirements}

            NON-FUNCTIONAL REQUIREMENTS:
            {nonFunctionalRequirements}

            Provide:
            1. An outline of the proposed architecture
            2. The main backend components
            3. The data flows
            4. Recommended technologies
            5. Security and performance considerations
            """;

    public static final String API_EXTRACTION_PROMPT = """
            From the following task, extract the required endpoints and the data model:

            {assignment}

            Format your answer in two sections:

            ENDPOINTS:
            - (list of endpoints)

            DATA MODEL:
            (description of the model)
            """;

    public static final String API_IMPLEMENTATION_PROMPT = """
            Implement an API for: {apiName}

            REQUIRED ENDPOINTS:
            {requiredEndpoints}

            DATA MODEL:
            {dataModel}

            CONSTRAINTS:
            {constraints}

            Provide:
            1. The route and endpoint definitions
            2. The input and output data structures
            3. The main business logic
            4. Security and validation considerations
            5. Usage examples
            """;

    public static final String BACKEND_MIXED_PROMPT = """
            As backend developer, complete the following task with every necessary detail:

            {assignment}

            Provide a complete solution that includes:
            1. The backend architecture design where needed
            2. The technical implementation with the necessary code
            3. The reasons behind your architecture and implementation choices
            4. The integration interfaces with the frontend
            """;

    // Error report
    public static final String ERROR_REPORT_TEMPLATE = """
            ERROR WHILE SOLVING THE TASK

            Task %s failed: %s

            Check the logs for more details.
            """;
}
