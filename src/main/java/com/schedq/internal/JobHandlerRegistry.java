package com.schedq.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.schedq.JobContext;
import com.schedq.JobHandler;
import com.schedq.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each {@link JobType} to the single {@link JobHandler} bean that runs it.
 */
@Component
public class JobHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final Map<JobType, RegisteredHandler> handlers;

    @Autowired
    public JobHandlerRegistry(ObjectProvider<JobHandler<?>> handlerBeans,
            @Qualifier("schedqObjectMapper") ObjectMapper objectMapper) {
        this(handlerBeans.orderedStream().toList(), objectMapper);
    }

    JobHandlerRegistry(List<JobHandler<?>> handlerBeans, ObjectMapper objectMapper) {
        Map<JobType, RegisteredHandler> registrations = new EnumMap<>(JobType.class);
        for (JobHandler<?> handler : handlerBeans) {
            JobType type = handler.getJobType();
            if (type == null) {
                throw new IllegalStateException("JobHandler " + ClassUtils.getUserClass(handler).getName()
                        + " must declare a job type");
            }
            RegisteredHandler existing = registrations.putIfAbsent(type,
                    new RegisteredHandler(handler, payloadReaderFor(objectMapper, handler.getPayloadClass())));
            if (existing != null) {
                throw new IllegalStateException("Duplicate job type '" + type.getValue() + "' detected while registering "
                        + ClassUtils.getUserClass(handler).getName() + ". Each job type must be unique.");
            }
        }
        this.handlers = registrations;
        log.info("Registered {} job handler(s): {}", handlers.size(), handlers.keySet());
    }

    public boolean hasHandler(JobType type) {
        return handlers.containsKey(type);
    }

    public Set<JobType> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * Converts the raw payload to the handler's payload type and runs it.
     *
     * @throws IllegalStateException if no handler is registered for {@code type}
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public Object invoke(JobType type, JobContext context, JsonNode payload) throws Exception {
        RegisteredHandler registration = handlers.get(type);
        if (registration == null) {
            throw new IllegalStateException("No handler found for job type: " + (type == null ? null : type.getValue()));
        }
        Object converted = registration.reader() == null || payload == null || payload.isNull()
                ? null
                : registration.reader().readValue(payload);
        return ((JobHandler) registration.handler()).handle(context, converted);
    }

    private static ObjectReader payloadReaderFor(ObjectMapper objectMapper, Class<?> payloadClass) {
        if (payloadClass == Void.class) {
            return null;
        }
        return objectMapper.readerFor(payloadClass);
    }

    private record RegisteredHandler(JobHandler<?> handler, ObjectReader reader) {
    }
}
