package org.eventbus.rabbitmq.subscriber;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Supplies handler instances for registered handler types, usually backed by a DI container.
 */
@FunctionalInterface
public interface HandlerResolver {

    <H> H resolve(Class<H> handlerType);

    /**
     * Resolver creating one instance per handler type through its no-argument constructor.
     */
    static HandlerResolver instantiating() {
        Map<Class<?>, Object> instances = new ConcurrentHashMap<>();
        return new HandlerResolver() {
            @Override
            public <H> H resolve(Class<H> handlerType) {
                return handlerType.cast(instances.computeIfAbsent(handlerType, type -> {
                    try {
                        return type.getDeclaredConstructor().newInstance();
                    } catch (ReflectiveOperationException e) {
                        throw new IllegalStateException("Cannot instantiate handler " + type.getName(), e);
                    }
                }));
            }
        };
    }

    /**
     * Resolver over existing handler instances, matched by exact class.
     */
    static HandlerResolver of(Object... handlers) {
        Map<Class<?>, Object> instances = new ConcurrentHashMap<>();
        for (Object handler : handlers) {
            instances.put(handler.getClass(), handler);
        }
        return new HandlerResolver() {
            @Override
            public <H> H resolve(Class<H> handlerType) {
                Object instance = instances.get(handlerType);
                if (instance == null) {
                    throw new IllegalStateException("No handler instance registered for " + handlerType.getName());
                }
                return handlerType.cast(instance);
            }
        };
    }
}
