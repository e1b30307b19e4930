package com.cronq;

import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes jobs of one type. Register implementations as Spring beans; the
 * {@link com.cronq.internal.JobPoller} picks them up.
 * <p>
 * If the payload type implements {@link com.cronq.schedule.ScheduleHookProvider},
 * jobs of this type can be enqueued with a dynamic schedule.
 *
 * @param <T> the payload type the job's JSON payload is read into
 */
public interface JobWorker<T> {

    Map<Class<?>, Class<?>> PAYLOAD_CLASS_CACHE = new ConcurrentHashMap<>();

    /**
     * The globally unique job type handled by this worker. By default this is the
     * value of the {@link com.cronq.annotation.Job} annotation.
     */
    default String getJobType() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        com.cronq.annotation.Job annotation = AnnotationUtils.findAnnotation(targetClass,
                com.cronq.annotation.Job.class);
        if (annotation == null || annotation.value().isBlank()) {
            throw new IllegalStateException("JobWorker " + targetClass.getName() +
                    " must either be annotated with @Job or override getJobType()");
        }
        return annotation.value();
    }

    /**
     * Processes one attempt. A thrown exception is recorded as the job's
     * {@code last_error}; whether the job then runs again depends on its schedule.
     */
    void process(UUID jobId, T payload) throws Exception;

    /**
     * Called when {@link #process(UUID, Object)} throws or times out. Failures here
     * are logged and do not change the outcome.
     */
    default void onError(UUID jobId, T payload, Exception exception) {
        // no-op
    }

    /**
     * Called after a successful attempt. Failures here are logged and do not
     * change the outcome.
     */
    default void onSuccess(UUID jobId, T payload) {
        // no-op
    }

    /**
     * The payload class, inferred from {@code JobWorker<T>} unless overridden.
     */
    @SuppressWarnings("unchecked")
    default Class<T> getPayloadClass() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        Class<?> payloadClass = PAYLOAD_CLASS_CACHE.computeIfAbsent(targetClass, JobWorker::inferPayloadClass);
        return (Class<T>) payloadClass;
    }

    private static Class<?> inferPayloadClass(Class<?> targetClass) {
        Class<?> resolved = ResolvableType.forClass(targetClass)
                .as(JobWorker.class)
                .getGeneric(0)
                .resolve();
        if (resolved == null) {
            throw new IllegalStateException("JobWorker " + targetClass.getName()
                    + " payload type cannot be inferred. Specify a concrete generic type or override getPayloadClass().");
        }
        return resolved;
    }
}
