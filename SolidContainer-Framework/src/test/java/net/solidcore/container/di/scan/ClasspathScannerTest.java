package net.solidcore.container.di.scan;

import net.solidcore.container.annotation.component.Service;
import net.solidcore.container.di.Lifetime;
import net.solidcore.container.di.ServiceContainer;
import net.solidcore.container.di.scan.fixtures.AuditLog;
import net.solidcore.container.di.scan.fixtures.MemoryAuditLog;
import net.solidcore.container.di.scan.fixtures.OrderService;
import net.solidcore.container.di.scan.fixtures.UnannotatedHelper;
import net.solidcore.container.di.scan.shared.SettingsReader;
import net.solidcore.container.di.scan.shared.SettingsStore;
import net.solidcore.container.di.scan.shared.SettingsWriter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for registering {@link Service} classes found on the classpath.
 */
class ClasspathScannerTest {

    private static final String FIXTURES = "net.solidcore.container.di.scan.fixtures";

    @Test
    void findsOnlyAnnotatedClasses() {
        ClasspathScanner scanner = new ClasspathScanner(FIXTURES);

        assertThat(scanner.getTypesAnnotatedWith(Service.class))
                .containsExactlyInAnyOrder(MemoryAuditLog.class, OrderService.class)
                .doesNotContain(UnannotatedHelper.class);
    }

    @Test
    void registersServicesWithDeclaredTypesAndLifetimes() {
        // Arrange
        ServiceContainer container = new ServiceContainer();

        // Act
        int registered = new ClasspathScanner(FIXTURES).registerServices(container);

        // Assert
        assertThat(registered).isEqualTo(2);
        assertThat(container.getRegistration(AuditLog.class).getLifetime()).isEqualTo(Lifetime.SINGLETON);
        assertThat(container.getRegistration(OrderService.class).getLifetime()).isEqualTo(Lifetime.TRANSIENT);
        assertThat(container.isRegistered(MemoryAuditLog.class)).isFalse();
    }

    @Test
    void scannedServicesAreWired() {
        ServiceContainer container = new ServiceContainer();
        new ClasspathScanner(FIXTURES).registerServices(container);

        container.getService(OrderService.class).placeOrder("book");
        container.getService(OrderService.class).placeOrder("pen");

        MemoryAuditLog auditLog = (MemoryAuditLog) container.getService(AuditLog.class);
        assertThat(auditLog.getEntries()).containsExactly("ordered book", "ordered pen");
    }

    @Test
    void serviceTypeNotImplementedIsRejected() {
        ServiceContainer container = new ServiceContainer();
        ClasspathScanner scanner = new ClasspathScanner("net.solidcore.container.di.scan.invalid");

        assertThatThrownBy(() -> scanner.registerServices(container))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MismatchedService is not assignable to java.lang.Runnable");
    }

    @Test
    void singletonBoundToSeveralTypesIsCreatedOnce() {
        // Arrange
        SettingsStore.CREATED.set(0);
        ServiceContainer container = new ServiceContainer();
        new ClasspathScanner("net.solidcore.container.di.scan.shared").registerServices(container);

        // Act
        SettingsReader reader = container.getService(SettingsReader.class);
        SettingsWriter writer = container.getService(SettingsWriter.class);
        writer.write("theme", "dark");

        // Assert
        assertThat(reader).isSameAs(writer);
        assertThat(reader.read("theme")).isEqualTo("dark");
        assertThat(SettingsStore.CREATED.get()).isEqualTo(1);
        assertThat(container.isRegistered(SettingsStore.class)).isFalse();
    }
}
