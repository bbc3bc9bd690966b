package com.bko.team.bus;

import com.bko.team.config.AgentTeamProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory publish/subscribe relay for inter-agent messages.
 * <p>
 * Published messages are kept in a bounded log for later queries and delivered synchronously
 * to every subscriber whose filter matches. A failing subscriber never affects the publisher
 * or the other subscribers.
 */
@Service
@Slf4j
public class MessageBus {

    private final int maxMessages;
    private final Deque<TeamMessage> messages = new ArrayDeque<>();
    private final CopyOnWriteArrayList<Registration> subscribers = new CopyOnWriteArrayList<>();

    public MessageBus(AgentTeamProperties properties) {
        this.maxMessages = properties.getBus().getMaxMessages();
    }

    /**
     * Records and delivers a message.
     *
     * @return the message id
     */
    public String publish(TeamMessage message) {
        synchronized (messages) {
            messages.addLast(message);
            while (messages.size() > maxMessages) {
                messages.removeFirst();
            }
        }
        log.debug("Publishing {} message {} from {}", message.messageType(), message.id(), message.senderRole());
        for (Registration registration : subscribers) {
            if (registration.filter().matches(message)) {
                deliverSafely(registration.consumer(), message);
            }
        }
        return message.id();
    }

    public Subscription subscribe(MessageFilter filter, Consumer<TeamMessage> consumer) {
        Registration registration = new Registration(filter, consumer);
        subscribers.add(registration);
        log.debug("Subscribed with filter {}", filter);
        return () -> subscribers.remove(registration);
    }

    public List<TeamMessage> messages(MessageFilter filter) {
        synchronized (messages) {
            return messages.stream().filter(filter::matches).toList();
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<TeamMessage> subscriber, TeamMessage message) {
        try {
            subscriber.accept(message);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing message {}: {}", message.id(), e.getMessage(), e);
        }
    }

    private record Registration(MessageFilter filter, Consumer<TeamMessage> consumer) {
    }
}
