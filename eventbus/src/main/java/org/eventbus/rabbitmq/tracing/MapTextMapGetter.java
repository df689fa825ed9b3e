package org.eventbus.rabbitmq.tracing;

import io.opentelemetry.context.propagation.TextMapGetter;

import java.util.Map;

class MapTextMapGetter implements TextMapGetter<Map<String, String>> {
    @Override
    public String get(Map<String, String> carrier, String key) {
        return carrier == null ? null : carrier.get(key);
    }

    @Override
    public Iterable<String> keys(Map<String, String> carrier) {
        return carrier.keySet();
    }
}
