package io.pglisten.spring.boot;

import io.pglisten.NotificationHandler;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects beans annotated with {@link NotificationChannel} into a channel-to-handler map.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see NotificationChannel
 */
public class NotificationHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final Map<String, NotificationHandler> handlers = new LinkedHashMap<>();

    public NotificationHandlerRegistrar(ListableBeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(NotificationChannel.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof NotificationHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @NotificationChannel must implement NotificationHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            NotificationChannel annotation = AnnotationUtils.findAnnotation(bean.getClass(), NotificationChannel.class);
            if (annotation == null) {
                annotation = beanFactory.findAnnotationOnBean(beanName, NotificationChannel.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @NotificationChannel annotation on " + bean.getClass().getName());
            }

            String channel = annotation.value();
            if (channel.isBlank()) {
                throw new BeanCreationException(beanName, "@NotificationChannel value must not be blank");
            }
            if (handlers.putIfAbsent(channel, handler) != null) {
                throw new BeanCreationException(beanName,
                        "Duplicate handler for channel '" + channel + "'");
            }
        }
    }

    /**
     * @return the registered handlers by channel name
     */
    public Map<String, NotificationHandler> handlers() {
        return Collections.unmodifiableMap(handlers);
    }
}
