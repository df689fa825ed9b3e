package demo.events;

import org.eventbus.rabbitmq.subscriber.SubscribeEvent;

public class UserCreated extends SubscribeEvent {

    private String userId;
    private String userName;

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }
}
