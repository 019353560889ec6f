package com.schedq;

import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Performs the work behind one {@link JobType}. Implementations must be Spring beans to be picked up by the
 * worker; at most one handler may be registered per type.
 *
 * @param <T> the payload type the job's JSON payload is converted to
 */
public interface JobHandler<T> {

    Map<Class<?>, Class<?>> PAYLOAD_CLASS_CACHE = new ConcurrentHashMap<>();

    JobType getJobType();

    /**
     * Runs one attempt. The returned value, if any, is stored as the execution output. Throwing fails the
     * attempt and hands the job to the retry policy.
     */
    Object handle(JobContext context, T payload) throws Exception;

    /**
     * The payload class, inferred from {@code JobHandler<T>} unless overridden.
     */
    @SuppressWarnings("unchecked")
    default Class<T> getPayloadClass() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        Class<?> payloadClass = PAYLOAD_CLASS_CACHE.computeIfAbsent(targetClass, JobHandler::inferPayloadClass);
        return (Class<T>) payloadClass;
    }

    private static Class<?> inferPayloadClass(Class<?> targetClass) {
        Class<?> resolved = ResolvableType.forClass(targetClass)
                .as(JobHandler.class)
                .getGeneric(0)
                .resolve();
        if (resolved == null) {
            throw new IllegalStateException("JobHandler " + targetClass.getName()
                    + " payload type cannot be inferred. Specify a concrete generic type or override getPayloadClass().");
        }
        return resolved;
    }
}
