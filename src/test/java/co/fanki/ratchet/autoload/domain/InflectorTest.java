package co.fanki.ratchet.autoload.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link Inflector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class InflectorTest {

    private final Inflector standard = Inflector.standard();

    private final Inflector withAcronyms = new Inflector(
            List.of("HTML", "API", "Https"), Map.of("oauth", "OAuth"));

    @Test
    void whenCamelizing_givenSnakeCaseName_shouldCapitalizeEveryWord() {
        assertEquals("Invoice", standard.camelize("invoice"));
        assertEquals("LineItem", standard.camelize("line_item"));
        assertEquals("UsersController",
                standard.camelize("users_controller"));
    }

    @Test
    void whenCamelizing_givenDigits_shouldKeepThem() {
        assertEquals("V2", standard.camelize("v2"));
        assertEquals("Oauth2Client", standard.camelize("oauth2_client"));
    }

    @Test
    void whenCamelizing_givenRepeatedUnderscores_shouldIgnoreEmptyWords() {
        assertEquals("FooBar", standard.camelize("foo__bar"));
    }

    @Test
    void whenCamelizing_givenAcronym_shouldUpperCaseIt() {
        assertEquals("HTMLParser", withAcronyms.camelize("html_parser"));
        assertEquals("PublicAPI", withAcronyms.camelize("public_api"));
        assertEquals("HTTPSClient", withAcronyms.camelize("https_client"));
    }

    @Test
    void whenCamelizing_givenExplicitInflection_shouldUseIt() {
        assertEquals("OAuth", withAcronyms.camelize("oauth"));
    }

    @Test
    void whenUnderscoring_givenCamelCaseName_shouldSplitWords() {
        assertEquals("line_item", standard.underscore("LineItem"));
        assertEquals("invoice", standard.underscore("Invoice"));
        assertEquals("users_controller",
                standard.underscore("UsersController"));
    }

    @Test
    void whenUnderscoring_givenUpperCaseRun_shouldSplitBeforeLastCapital() {
        assertEquals("html_parser", standard.underscore("HTMLParser"));
    }

    @Test
    void whenUnderscoring_givenAcronym_shouldKeepItAsOneWord() {
        assertEquals("public_api", withAcronyms.underscore("PublicAPI"));
        assertEquals("html_parser", withAcronyms.underscore("HTMLParser"));
    }

    @Test
    void whenUnderscoring_givenExplicitInflection_shouldReverseIt() {
        assertEquals("oauth", withAcronyms.underscore("OAuth"));
    }

    @Test
    void whenUnderscoring_givenUnderscoreInName_shouldNotDoubleIt() {
        assertEquals("foo_bar", standard.underscore("Foo_Bar"));
    }

    @Test
    void whenRoundTripping_givenConventionalNames_shouldReturnOriginal() {
        for (final String name : List.of("Invoice", "LineItem",
                "UsersController", "V2")) {
            assertEquals(name, standard.camelize(standard.underscore(name)));
        }
    }

    @Test
    void whenCreating_givenInflectionToInvalidConstant_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new Inflector(List.of(), Map.of("oauth", "o_auth")));
    }

}
