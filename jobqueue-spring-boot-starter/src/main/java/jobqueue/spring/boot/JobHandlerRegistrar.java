package jobqueue.spring.boot;

import jobqueue.worker.DefaultJobHandlerRegistry;
import jobqueue.worker.JobHandler;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link JobHandlerFor} and registers them
 * in the {@link DefaultJobHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * which is before the queue is started by {@link JobQueueLifecycle}.
 *
 * @see JobHandlerFor
 */
public class JobHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultJobHandlerRegistry registry;

    public JobHandlerRegistrar(ListableBeanFactory beanFactory, DefaultJobHandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(JobHandlerFor.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof JobHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @JobHandlerFor must implement JobHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation from getAnnotation
            JobHandlerFor annotation = AnnotationUtils.findAnnotation(bean.getClass(), JobHandlerFor.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @JobHandlerFor annotation on " + bean.getClass().getName());
            }
            String jobType = annotation.value();
            if (jobType.isBlank()) {
                throw new BeanCreationException(beanName, "@JobHandlerFor must name a job type");
            }

            try {
                registry.register(jobType, handler);
            } catch (IllegalStateException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
        }
    }
}
