package net.solidcore.container.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the constructor the container should prefer when several public constructors
 * share the greatest parameter count.
 *
 * <p>Example:
 * <pre>
 * public ReportService(Clock clock, ReportRepository repository) { ... }
 *
 * {@literal @}Inject
 * public ReportService(Clock clock, MessageLogger logger) { ... }
 * </pre>
 * Constructors with fewer parameters are never chosen over a longer one, annotated or not.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.CONSTRUCTOR)
public @interface Inject {
}
