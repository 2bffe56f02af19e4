package io.pglisten.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler of one notification channel.
 *
 * <p>The annotated bean must implement {@link io.pglisten.NotificationHandler}, and
 * each channel may have only one handler.
 *
 * <pre>{@code
 * @Component
 * @NotificationChannel("orders")
 * public class OrdersHandler implements NotificationHandler {
 *     public void handle(NotificationOrTimeout event) { ... }
 * }
 * }</pre>
 *
 * @see NotificationHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface NotificationChannel {

    /**
     * Channel name, case-sensitive.
     */
    String value();
}
