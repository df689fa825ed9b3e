package org.eventbus.rabbitmq.connection;

import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ExceptionHandler;
import org.eventbus.rabbitmq.config.HostSettings;
import org.eventbus.rabbitmq.exception.ConnectionException;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;

/**
 * Builds client {@link ConnectionFactory} instances from {@link HostSettings}.
 *
 * <p>Automatic recovery of the client library is switched off: {@link RabbitMqConnection}
 * owns recovery.</p>
 */
public final class ConnectionFactories {

    private ConnectionFactories() {
    }

    public static ConnectionFactory create(HostSettings settings, ExceptionHandler exceptionHandler) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(settings.getHostName());
        factory.setPort(settings.getHostPort() != null ? settings.getHostPort() : HostSettings.DEFAULT_HOST_PORT);
        factory.setUsername(settings.getUserName());
        factory.setPassword(settings.getPassword());
        factory.setVirtualHost(settings.getVirtualHost());
        if (settings.getConnectionTimeout() != null) {
            factory.setConnectionTimeout(settings.getConnectionTimeout());
        }
        if (settings.getHeartbeat() != null) {
            factory.setRequestedHeartbeat(settings.getHeartbeat());
        }

        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        if (exceptionHandler != null) {
            factory.setExceptionHandler(exceptionHandler);
        }

        if (Boolean.TRUE.equals(settings.getUseTls())) {
            factory.useSslProtocol(sslContext(settings));
            factory.enableHostnameVerification();
        }

        return factory;
    }

    static SSLContext sslContext(HostSettings settings) {
        String protocol = settings.getSslProtocolVersion() != null
                ? settings.getSslProtocolVersion() : HostSettings.DEFAULT_SSL_PROTOCOL;
        try {
            SSLContext context = SSLContext.getInstance(protocol);
            context.init(keyManagers(settings), null, null);
            return context;
        } catch (Exception e) {
            throw new ConnectionException("Failed to configure TLS for the '" + settings.getVirtualHost()
                    + "' virtual host of '" + settings.getHostName() + "'", e);
        }
    }

    private static KeyManager[] keyManagers(HostSettings settings) throws Exception {
        String path = settings.getClientCertPath();
        if (path == null || path.isEmpty()) {
            return null;
        }
        char[] password = settings.getClientCertPassword() != null
                ? settings.getClientCertPassword().toCharArray() : new char[0];
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            keyStore.load(is, password);
        }
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, password);
        return kmf.getKeyManagers();
    }
}
