package co.fanki.ratchet.autoload.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link NamespaceIndex}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class NamespaceIndexTest {

    private static final NamespacePath BILLING = NamespacePath.of("Billing");

    private static final NamespacePath INVOICE =
            NamespacePath.of("Billing", "Invoice");

    @Test
    void whenQuerying_givenEmptyIndex_shouldOnlyKnowTheTopLevel() {
        final NamespaceIndex index = NamespaceIndex.empty();

        assertTrue(index.isKnown(NamespacePath.root()));
        assertFalse(index.isKnown(BILLING));
        assertEquals(0, index.size());
    }

    @Test
    void whenAddingFile_givenNestedPath_shouldRegisterParentNamespaces() {
        final NamespaceIndex index = NamespaceIndex.builder()
                .file(INVOICE, "app/models/billing/invoice.rb")
                .build();

        assertTrue(index.isKnown(BILLING));
        assertTrue(index.isKnown(INVOICE));
        assertEquals(Optional.empty(), index.definingFile(BILLING));
        assertEquals(Optional.of("app/models/billing/invoice.rb"),
                index.definingFile(INVOICE));
    }

    @Test
    void whenAddingFileAndDirectory_givenSamePath_shouldMergeThem() {
        final NamespaceIndex index = NamespaceIndex.builder()
                .namespace(BILLING)
                .file(BILLING, "app/models/billing.rb")
                .namespace(BILLING)
                .build();

        final NamespaceEntry entry = index.entry(BILLING).orElseThrow();
        assertTrue(entry.isDirectory());
        assertEquals(Optional.of("app/models/billing.rb"),
                entry.definingFile());
        assertEquals(1, index.size());
    }

    @Test
    void whenAddingFile_givenTwoFilesForOnePath_shouldThrowCollision() {
        final NamespaceIndex.Builder builder = NamespaceIndex.builder()
                .file(INVOICE, "app/models/billing/invoice.rb");

        final NamespaceCollisionException e = assertThrows(
                NamespaceCollisionException.class,
                () -> builder.file(INVOICE, "lib/billing/invoice.rb"));

        assertEquals(INVOICE, e.path());
        assertEquals("app/models/billing/invoice.rb", e.firstFile());
        assertEquals("lib/billing/invoice.rb", e.secondFile());
        assertEquals(NamespaceCollisionException.ERROR_CODE,
                e.getErrorCode());
    }

    @Test
    void whenAddingFile_givenSameFileTwice_shouldNotCollide() {
        final NamespaceIndex index = NamespaceIndex.builder()
                .file(INVOICE, "app/models/billing/invoice.rb")
                .file(INVOICE, "app/models/billing/invoice.rb")
                .build();

        assertEquals(1, index.fileCount());
    }

    @Test
    void whenLookingUpFile_givenDefiningFile_shouldReturnConstant() {
        final NamespaceIndex index = NamespaceIndex.builder()
                .file(INVOICE, "app/models/billing/invoice.rb")
                .build();

        assertEquals(Optional.of(INVOICE),
                index.constantDefinedIn("app/models/billing/invoice.rb"));
        assertEquals(Optional.empty(),
                index.constantDefinedIn("app/models/order.rb"));
    }

    @Test
    void whenListingEntries_givenUnorderedInsertion_shouldSortByPath() {
        final NamespaceIndex index = NamespaceIndex.builder()
                .file(NamespacePath.of("Order"), "app/models/order.rb")
                .file(INVOICE, "app/models/billing/invoice.rb")
                .root(AutoloadRoot.topLevel(Path.of("app/models")))
                .build();

        assertEquals(List.of(BILLING, INVOICE, NamespacePath.of("Order")),
                index.entries().stream().map(NamespaceEntry::path).toList());
        assertEquals(1, index.roots().size());
    }

    @Test
    void whenAddingFile_givenTopLevelPath_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> NamespaceIndex.builder().file(NamespacePath.root(),
                        "app/models/x.rb"));
    }

}
