package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.autoload.domain.NamespaceIndex;
import co.fanki.ratchet.autoload.domain.NamespacePath;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ReferenceExtractor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ReferenceExtractorTest {

    private final SyntaxTrees trees = new SyntaxTrees();

    private final NamespaceIndex index = NamespaceIndex.builder()
            .file(NamespacePath.of("Order"), "app/models/order.rb")
            .file(NamespacePath.of("Billing", "Invoice"),
                    "app/models/billing/invoice.rb")
            .build();

    @Test
    void whenExtracting_givenKnownAndUnknownConstants_shouldKeepResolved() {
        final SyntaxNode root = trees.program(
                trees.call(trees.constant("Order"), trees.identifier("find")),
                trees.constant("SomeGemClass"),
                trees.module(trees.constant("Billing"),
                        trees.constant("Invoice")));

        final List<Reference> references = ReferenceExtractor.standard()
                .extract(root, "app/jobs/sync.rb",
                        new ConstantResolver(index));

        assertEquals(List.of("::Order", "::Billing::Invoice"),
                references.stream()
                        .map(r -> r.constant().qualifiedName()).toList());
        assertEquals("app/jobs/sync.rb", references.get(0).sourceFile());
    }

    @Test
    void whenCollecting_givenTree_shouldNotNeedTheIndex() {
        final SyntaxNode root = trees.program(trees.constant("Anything"),
                trees.constant("Else"));

        final List<UnresolvedReference> unresolved =
                ReferenceExtractor.standard().collect(root, "x.rb");

        assertEquals(2, unresolved.size());
    }

    @Test
    void whenResolving_givenUnresolvedReferences_shouldAskResolverForEach() {
        final ConstantResolver resolver = mock(ConstantResolver.class);
        when(resolver.resolve(any())).thenReturn(Optional.empty());
        final SyntaxNode root = trees.program(trees.constant("A"),
                trees.constant("B"), trees.constant("C"));
        final ReferenceExtractor extractor = ReferenceExtractor.standard();

        final List<Reference> references = extractor.resolve(
                extractor.collect(root, "x.rb"), resolver);

        assertEquals(0, references.size());
        verify(resolver, times(3)).resolve(any());
    }

    @Test
    void whenExtracting_givenCustomInspector_shouldUseIt() {
        final ConstantReferenceInspector everyIdentifier =
                (node, parent, scope, path) -> node.type().equals("identifier")
                        ? Optional.of(new UnresolvedReference(
                                ConstantName.lexical("Order"), scope, path,
                                node.span()))
                        : Optional.empty();
        final ReferenceExtractor extractor = new ReferenceExtractor(
                new ScopeTrackingWalker(new ClassModuleDeclarations()),
                List.of(everyIdentifier));

        final List<Reference> references = extractor.extract(
                trees.program(trees.identifier("order")), "x.rb",
                new ConstantResolver(index));

        assertEquals(1, references.size());
    }

    @Test
    void whenCreating_givenNoInspectors_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReferenceExtractor(new ScopeTrackingWalker(
                        new ClassModuleDeclarations()), List.of()));
    }

}
