package demo.events;

import org.eventbus.rabbitmq.subscriber.EventHandler;

public class UserCreatedHandler implements EventHandler<UserCreated> {

    @Override
    public void handle(UserCreated event) {
        System.out.printf("[users] created %s (%s), eventId=%s%n",
                event.getUserName(), event.getUserId(), event.getEventId());
    }
}
