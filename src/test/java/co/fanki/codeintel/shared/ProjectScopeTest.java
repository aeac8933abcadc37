package co.fanki.codeintel.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ProjectScope}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectScopeTest {

    @Test
    void whenQualifying_givenNamedProject_shouldPrefixWithProjectName() {
        final ProjectScope scope = ProjectScope.of("demo");

        assertEquals("demo::A", scope.qualify("A"));
        assertEquals("demo", scope.storageKey());
        assertEquals("demo", scope.displayName());
        assertFalse(scope.isUnscoped());
    }

    @Test
    void whenQualifying_givenUnscoped_shouldReturnRawId() {
        final ProjectScope scope = ProjectScope.unscoped();

        assertEquals("A", scope.qualify("A"));
        assertEquals("", scope.storageKey());
        assertEquals("(default)", scope.displayName());
        assertTrue(scope.isUnscoped());
        assertTrue(scope.name().isEmpty());
    }

    @Test
    void whenCreatingFromNullable_givenBlankName_shouldReturnUnscoped() {
        assertSame(ProjectScope.unscoped(), ProjectScope.ofNullable("  "));
        assertSame(ProjectScope.unscoped(), ProjectScope.ofNullable(null));
    }

    @Test
    void whenRestoringFromStorageKey_givenEmptyKey_shouldEqualUnscoped() {
        assertEquals(ProjectScope.unscoped(), ProjectScope.fromStorageKey(""));
        assertEquals(ProjectScope.of("demo"),
                ProjectScope.fromStorageKey("demo"));
    }

    @Test
    void whenCreating_givenBlankName_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> ProjectScope.of(" "));
    }

}
