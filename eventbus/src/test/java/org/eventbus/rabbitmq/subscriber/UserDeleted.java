package org.eventbus.rabbitmq.subscriber;

public class UserDeleted extends SubscribeEvent {

    private String userName;

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }
}
