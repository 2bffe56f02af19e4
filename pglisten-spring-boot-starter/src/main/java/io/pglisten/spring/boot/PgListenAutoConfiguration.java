package io.pglisten.spring.boot;

import io.pglisten.NotificationListener;
import io.pglisten.connection.ExponentialBackoffReconnectPolicy;
import io.pglisten.connection.ReconnectPolicy;
import io.pglisten.jdbc.JdbcListenConnectionFactory;
import io.pglisten.spi.ListenConnectionFactory;
import io.pglisten.spi.MetricsExporter;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Auto-configuration for the LISTEN/NOTIFY listener.
 *
 * <p>Wires a {@link NotificationListener} from a {@link ListenConnectionFactory}
 * (derived from the application {@link DataSource} unless one is defined) and
 * {@link PgListenProperties}, and starts it for every {@link NotificationChannel}
 * handler bean when the context starts.
 *
 * @see PgListenProperties
 * @see PgListenMicrometerAutoConfiguration
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@ConditionalOnClass(NotificationListener.class)
@ConditionalOnProperty(prefix = "pglisten", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(PgListenProperties.class)
public class PgListenAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public NotificationHandlerRegistrar notificationHandlerRegistrar(ListableBeanFactory beanFactory) {
        return new NotificationHandlerRegistrar(beanFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ListenConnectionFactory.class)
    public NotificationListener notificationListener(PgListenProperties props,
                                                     ListenConnectionFactory connectionFactory,
                                                     ObjectProvider<ReconnectPolicy> reconnectPolicyProvider,
                                                     ObjectProvider<MetricsExporter> metricsProvider) {
        PgListenProperties.Reconnect reconnect = props.getReconnect();
        ReconnectPolicy reconnectPolicy = reconnectPolicyProvider.getIfAvailable(() ->
                new ExponentialBackoffReconnectPolicy(
                        reconnect.getBaseDelayMs(), reconnect.getMaxDelayMs(), reconnect.isJitter()));

        var builder = NotificationListener.builder()
                .connectionFactory(connectionFactory)
                .reconnectPolicy(reconnectPolicy)
                .shutdownTimeout(props.getShutdownTimeout());
        if (props.getHeartbeatInterval() != null) {
            builder.heartbeatInterval(props.getHeartbeatInterval());
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(NotificationListener.class)
    public NotificationListenerLifecycle notificationListenerLifecycle(NotificationListener listener,
                                                                       NotificationHandlerRegistrar registrar,
                                                                       PgListenProperties props) {
        return new NotificationListenerLifecycle(listener, registrar, props);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnMissingBean(ListenConnectionFactory.class)
    static class JdbcConnectionFactoryConfiguration {

        @Bean
        public JdbcListenConnectionFactory listenConnectionFactory(DataSource dataSource, PgListenProperties props) {
            return JdbcListenConnectionFactory.of(dataSource)
                    .withPollTimeout(Duration.ofMillis(props.getJdbc().getPollTimeoutMs()));
        }
    }
}
