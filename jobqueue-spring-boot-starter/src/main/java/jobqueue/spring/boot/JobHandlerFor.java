package jobqueue.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for a job type.
 *
 * <p>The annotated bean must implement {@link jobqueue.worker.JobHandler}.
 *
 * <pre>{@code
 * @Component
 * @JobHandlerFor("send-email")
 * public class SendEmailHandler implements JobHandler {
 *   public void handle(JobContext ctx) { ... }
 * }
 * }</pre>
 *
 * @see JobHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface JobHandlerFor {

    /**
     * Job type handled by the bean. Must not be blank.
     */
    String value();
}
