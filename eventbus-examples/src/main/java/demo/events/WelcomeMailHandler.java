package demo.events;

import org.eventbus.rabbitmq.subscriber.EventHandler;

/**
 * Second handler of {@link UserCreated}: both run, in registration order.
 */
public class WelcomeMailHandler implements EventHandler<UserCreated> {

    @Override
    public void handle(UserCreated event) {
        System.out.printf("[mail] sending welcome mail to %s%n", event.getUserName());
    }
}
