package net.solidcore.container.di.engine;

import net.solidcore.container.annotation.Inject;
import net.solidcore.container.di.exception.NoPublicConstructorException;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for constructor selection, including the tie-break between equal-arity constructors.
 */
class ConstructorSelectorTest {

    @Test
    void mostParametersWin() {
        Constructor<?> constructor = ConstructorSelector.select(ThreeConstructors.class);

        assertThat(constructor.getParameterTypes()).containsExactly(Alpha.class, Beta.class);
    }

    @Test
    void defaultConstructorIsSelectedWhenItIsTheOnlyOne() {
        Constructor<?> constructor = ConstructorSelector.select(Alpha.class);

        assertThat(constructor.getParameterCount()).isZero();
    }

    @Test
    void injectAnnotationBreaksTies() {
        Constructor<?> constructor = ConstructorSelector.select(AnnotatedTie.class);

        assertThat(constructor.isAnnotationPresent(Inject.class)).isTrue();
        assertThat(constructor.getParameterTypes()).containsExactly(Gamma.class);
    }

    @Test
    void injectAnnotationDoesNotOutrankArity() {
        Constructor<?> constructor = ConstructorSelector.select(AnnotatedShorter.class);

        assertThat(constructor.getParameterTypes()).containsExactly(Alpha.class, Beta.class);
    }

    @Test
    void unannotatedTiesAreOrderedByParameterTypeNames() {
        // Arrange: $Alpha sorts before $Beta whatever order reflection reports
        Constructor<?> constructor = ConstructorSelector.select(PlainTie.class);

        // Assert
        assertThat(constructor.getParameterTypes()).containsExactly(Alpha.class);
        assertThat(ConstructorSelector.select(PlainTie.class)).isEqualTo(constructor);
    }

    @Test
    void nonPublicConstructorsAreIgnored() {
        Constructor<?> constructor = ConstructorSelector.select(MixedVisibility.class);

        assertThat(constructor.getParameterCount()).isEqualTo(1);
    }

    @Test
    void interfacesAndAbstractClassesHaveNoUsableConstructor() {
        assertThatThrownBy(() -> ConstructorSelector.select(Runnable.class))
                .isInstanceOf(NoPublicConstructorException.class);
        assertThatThrownBy(() -> ConstructorSelector.select(AbstractBase.class))
                .isInstanceOf(NoPublicConstructorException.class)
                .hasMessageContaining("AbstractBase");
    }

    @Test
    void classWithOnlyPrivateConstructorsFails() {
        assertThatThrownBy(() -> ConstructorSelector.select(PrivateOnly.class))
                .isInstanceOf(NoPublicConstructorException.class)
                .satisfies(e -> assertThat(((NoPublicConstructorException) e).getImplementationType()).isEqualTo(PrivateOnly.class));
    }

    // Test types

    public static class Alpha {
    }

    public static class Beta {
    }

    public static class Gamma {
    }

    public static class ThreeConstructors {
        public ThreeConstructors() {
        }

        public ThreeConstructors(Alpha alpha) {
        }

        public ThreeConstructors(Alpha alpha, Beta beta) {
        }
    }

    public static class AnnotatedTie {
        public AnnotatedTie(Alpha alpha) {
        }

        @Inject
        public AnnotatedTie(Gamma gamma) {
        }
    }

    public static class AnnotatedShorter {
        @Inject
        public AnnotatedShorter(Gamma gamma) {
        }

        public AnnotatedShorter(Alpha alpha, Beta beta) {
        }
    }

    public static class PlainTie {
        public PlainTie(Beta beta) {
        }

        public PlainTie(Alpha alpha) {
        }
    }

    public static class MixedVisibility {
        public MixedVisibility(Alpha alpha) {
        }

        MixedVisibility(Alpha alpha, Beta beta) {
        }
    }

    public abstract static class AbstractBase {
        public AbstractBase() {
        }
    }

    public static class PrivateOnly {
        private PrivateOnly() {
        }
    }
}
