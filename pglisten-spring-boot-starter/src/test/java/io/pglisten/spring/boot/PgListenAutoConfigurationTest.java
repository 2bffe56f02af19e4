package io.pglisten.spring.boot;

import io.pglisten.ListenSession;
import io.pglisten.Notification;
import io.pglisten.NotificationHandler;
import io.pglisten.NotificationListener;
import io.pglisten.NotificationOrTimeout;
import io.pglisten.jdbc.JdbcListenConnectionFactory;
import io.pglisten.spi.ListenConnectionFactory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.pglisten.spring.boot.InMemoryListenConnectionFactory.waitFor;
import static org.junit.jupiter.api.Assertions.*;

class PgListenAutoConfigurationTest {

    private static final Duration WAIT = Duration.ofSeconds(3);

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PgListenAutoConfiguration.class));

    @Test
    void createsAllBeans() {
        runner.withUserConfiguration(FactoryConfig.class, HandlerConfig.class).run(ctx -> {
            assertTrue(ctx.containsBean("notificationListener"));
            assertTrue(ctx.containsBean("notificationHandlerRegistrar"));
            assertTrue(ctx.containsBean("notificationListenerLifecycle"));
            assertInstanceOf(NotificationListener.class, ctx.getBean(NotificationListener.class));
        });
    }

    @Test
    void derivesConnectionFactoryFromDataSource() {
        runner.withUserConfiguration(DataSourceConfig.class).run(ctx -> {
            assertInstanceOf(JdbcListenConnectionFactory.class, ctx.getBean(ListenConnectionFactory.class));
            assertTrue(ctx.containsBean("notificationListener"));
        });
    }

    @Test
    void userConnectionFactoryWins() {
        runner.withUserConfiguration(DataSourceConfig.class, FactoryConfig.class).run(ctx -> {
            assertInstanceOf(InMemoryListenConnectionFactory.class, ctx.getBean(ListenConnectionFactory.class));
            assertFalse(ctx.containsBean("listenConnectionFactory"));
        });
    }

    @Test
    void noListenerWithoutConnectionSource() {
        runner.run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertFalse(ctx.containsBean("notificationListener"));
            assertFalse(ctx.containsBean("notificationListenerLifecycle"));
        });
    }

    @Test
    void disabledByProperty() {
        runner.withPropertyValues("pglisten.enabled=false")
                .withUserConfiguration(FactoryConfig.class, HandlerConfig.class).run(ctx -> {
                    assertFalse(ctx.containsBean("notificationListener"));
                    assertFalse(ctx.containsBean("notificationHandlerRegistrar"));
                });
    }

    @Test
    void startsSessionForAnnotatedHandlers() {
        runner.withUserConfiguration(FactoryConfig.class, HandlerConfig.class).run(ctx -> {
            var factory = ctx.getBean(InMemoryListenConnectionFactory.class);
            var handler = ctx.getBean(OrdersHandler.class);
            var lifecycle = ctx.getBean(NotificationListenerLifecycle.class);

            assertTrue(lifecycle.isRunning());
            assertEquals(List.of("orders"), List.copyOf(lifecycle.session().channels()));
            assertTrue(waitFor(() -> factory.isSubscribed("orders"), WAIT));

            factory.notify("orders", "42");

            assertTrue(waitFor(() -> handler.events.size() == 1, WAIT));
            assertEquals(new Notification("orders", "42"), handler.events.get(0));
        });
    }

    @Test
    void closesSessionWhenContextStops() {
        runner.withUserConfiguration(FactoryConfig.class, HandlerConfig.class).run(ctx -> {
            var factory = ctx.getBean(InMemoryListenConnectionFactory.class);
            var lifecycle = ctx.getBean(NotificationListenerLifecycle.class);
            ListenSession session = lifecycle.session();
            assertTrue(waitFor(() -> factory.isSubscribed("orders"), WAIT));

            ctx.stop();

            assertFalse(lifecycle.isRunning());
            assertFalse(session.isRunning());
            assertTrue(factory.isClosed());
        });
    }

    @Test
    void noSessionWithoutHandlers() {
        runner.withUserConfiguration(FactoryConfig.class).run(ctx -> {
            var lifecycle = ctx.getBean(NotificationListenerLifecycle.class);
            assertFalse(lifecycle.isRunning());
            assertEquals(0, ctx.getBean(InMemoryListenConnectionFactory.class).connects());
        });
    }

    @Test
    void zeroTimeoutDisablesTimeoutEvents() {
        runner.withPropertyValues("pglisten.notification-timeout=0")
                .withUserConfiguration(FactoryConfig.class, HandlerConfig.class).run(ctx -> {
                    var handler = ctx.getBean(OrdersHandler.class);
                    assertTrue(ctx.getBean(NotificationListenerLifecycle.class).isRunning());
                    Thread.sleep(300);
                    assertTrue(handler.events.isEmpty());
                });
    }

    @Test
    void invalidShutdownTimeoutFailsStartup() {
        runner.withPropertyValues("pglisten.shutdown-timeout=0")
                .withUserConfiguration(FactoryConfig.class).run(ctx -> {
                    assertNotNull(ctx.getStartupFailure());
                    assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
                });
    }

    private static Throwable findRootCause(Throwable t) {
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t;
    }

    @Configuration
    static class FactoryConfig {
        @Bean
        InMemoryListenConnectionFactory inMemoryListenConnectionFactory() {
            return new InMemoryListenConnectionFactory();
        }
    }

    @Configuration
    static class DataSourceConfig {
        @Bean
        DataSource dataSource() {
            return (DataSource) Proxy.newProxyInstance(getClass().getClassLoader(),
                    new Class<?>[]{DataSource.class}, (proxy, method, args) -> {
                        if (method.getName().equals("toString")) {
                            return "UnusedDataSource";
                        }
                        throw new UnsupportedOperationException(method.getName());
                    });
        }
    }

    @Configuration
    static class HandlerConfig {
        @Bean
        OrdersHandler ordersHandler() {
            return new OrdersHandler();
        }
    }

    @NotificationChannel("orders")
    static class OrdersHandler implements NotificationHandler {
        final List<NotificationOrTimeout> events = new CopyOnWriteArrayList<>();

        @Override
        public void handle(NotificationOrTimeout event) {
            events.add(event);
        }
    }
}
