package io.github.chirino.social.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.ConstraintViolationException;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SocialOperationsTest {

    private SimpleMeterRegistry registry;
    private SocialOperations operations;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        operations = new SocialOperations();
        operations.registry = registry;
    }

    @Test
    void records_a_timer_per_operation() {
        String result = operations.run("touch.list", UUID.randomUUID(), null, () -> "done");
        operations.execute("touch.remove", UUID.randomUUID(), "x", () -> {});
        operations.execute("touch.remove", UUID.randomUUID(), "y", () -> {});

        assertEquals("done", result);
        Timer list = registry.find("social.operation").tag("operation", "touch.list").timer();
        Timer remove = registry.find("social.operation").tag("operation", "touch.remove").timer();
        assertNotNull(list);
        assertEquals(1, list.count());
        assertEquals(2, remove.count());
    }

    @Test
    void classified_failures_pass_through() {
        AccessDeniedException denied = new AccessDeniedException("not in touch");

        AccessDeniedException thrown =
                assertThrows(
                        AccessDeniedException.class,
                        () ->
                                operations.run(
                                        "dm.open",
                                        UUID.randomUUID(),
                                        UUID.randomUUID(),
                                        () -> {
                                            throw denied;
                                        }));

        assertSame(denied, thrown);
    }

    @Test
    void constraint_violations_pass_through() {
        ConstraintViolationException violation = new ConstraintViolationException(Set.of());

        ConstraintViolationException thrown =
                assertThrows(
                        ConstraintViolationException.class,
                        () ->
                                operations.run(
                                        "dm.order",
                                        UUID.randomUUID(),
                                        null,
                                        () -> {
                                            throw violation;
                                        }));

        assertSame(violation, thrown);
    }

    @Test
    void unexpected_failures_become_internal() {
        IllegalStateException boom = new IllegalStateException("connection reset");

        InternalFailureException thrown =
                assertThrows(
                        InternalFailureException.class,
                        () ->
                                operations.execute(
                                        "hush.send",
                                        UUID.randomUUID(),
                                        UUID.randomUUID(),
                                        () -> {
                                            throw boom;
                                        }));

        assertEquals(ErrorKind.INTERNAL, thrown.getKind());
        assertEquals("hush.send", thrown.getOperation());
        assertSame(boom, thrown.getCause());
    }
}
