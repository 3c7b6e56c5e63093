package co.fanki.ratchet.extraction.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ParserRegistry}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ParserRegistryTest {

    private SourceParser ruby;

    private SourceParser erb;

    private ParserRegistry registry;

    @BeforeEach
    void setUp() {
        ruby = mock(SourceParser.class);
        when(ruby.language()).thenReturn("ruby");
        when(ruby.supports(anyString())).thenAnswer(
                invocation -> invocation.<String>getArgument(0)
                        .endsWith(".rb"));

        erb = mock(SourceParser.class);
        when(erb.language()).thenReturn("erb");
        when(erb.supports(anyString())).thenAnswer(
                invocation -> invocation.<String>getArgument(0)
                        .endsWith(".erb"));

        registry = new ParserRegistry(List.of(ruby, erb));
    }

    @Test
    void whenLookingUpPath_givenKnownExtension_shouldReturnParser() {
        assertEquals(Optional.of(ruby),
                registry.forPath(Path.of("app/models/order.rb")));
        assertEquals(Optional.of(erb),
                registry.forPath(Path.of("app/views/show.html.erb")));
    }

    @Test
    void whenLookingUpPath_givenUnknownExtension_shouldReturnEmpty() {
        assertFalse(registry.supports(Path.of("logo.png")));
    }

    @Test
    void whenLookingUpLanguage_givenDifferentCase_shouldMatch() {
        assertEquals(Optional.of(erb), registry.forLanguage("ERB"));
        assertTrue(registry.forLanguage("python").isEmpty());
    }

}
