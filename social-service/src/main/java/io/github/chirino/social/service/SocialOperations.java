package io.github.chirino.social.service;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolationException;
import java.util.UUID;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Runs engine calls on behalf of the gateway. Every call is timed as {@code social.operation}
 * tagged with the operation name. Classified failures and request constraint violations pass
 * through; anything else is logged with the call context and rethrown as {@link
 * InternalFailureException}.
 */
@ApplicationScoped
public class SocialOperations {

    private static final Logger LOG = Logger.getLogger(SocialOperations.class);

    public static final String TIMER_NAME = "social.operation";

    @Inject MeterRegistry registry;

    public <T> T run(String operation, UUID actorId, Object targetId, Supplier<T> work) {
        try {
            return registry.timer(TIMER_NAME, "operation", operation).record(work);
        } catch (SocialException | ConstraintViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.errorf(
                    e,
                    "Operation %s failed for actor=%s target=%s",
                    operation,
                    actorId,
                    targetId);
            throw new InternalFailureException(operation, operation + " failed", e);
        }
    }

    public void execute(String operation, UUID actorId, Object targetId, Runnable work) {
        run(
                operation,
                actorId,
                targetId,
                () -> {
                    work.run();
                    return null;
                });
    }
}
