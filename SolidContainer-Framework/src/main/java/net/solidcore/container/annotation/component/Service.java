package net.solidcore.container.annotation.component;

import net.solidcore.container.di.Lifetime;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for concrete classes the classpath scanner registers in a container.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Service {

    /**
     * Register the class under the specified service types.
     * Usage: ChildClass implements ParentClass, Service({ParentClass.class})
     * If the provided types are not extended or implemented by the class an error will be thrown.
     * When empty, the class is registered under itself.
     *
     * @return The service types the class is bound to.
     */
    Class<?>[] value() default {};

    /**
     * @return The lifetime of the registration.
     */
    Lifetime lifetime() default Lifetime.SINGLETON;
}
