package behaviors.pathexpr;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for PathTokenizer - splitting path strings into tokens.
class PathTokenizerTest extends PathExprLoggingConfig {

    private static final Logger LOG = Logger.getLogger(PathTokenizerTest.class.getName());

    @Test
    void testSingleMember() {
        LOG.info(() -> "TEST: testSingleMember - originalSource");
        assertThat(PathTokenizer.tokenize("originalSource")).containsExactly(PathToken.member("originalSource"));
    }

    @Test
    void testMembersAndIndexer() {
        LOG.info(() -> "TEST: testMembersAndIndexer - originalSource.items[0].title");
        final var tokens = PathTokenizer.tokenize("originalSource.items[0].title");
        assertThat(tokens).containsExactly(
                PathToken.member("originalSource"),
                new PathToken("items", 0),
                PathToken.member("title"));
        assertThat(tokens.get(1).hasIndex()).isTrue();
        assertThat(tokens.get(2).hasIndex()).isFalse();
    }

    @Test
    void testWhitespaceIsTrimmedPerSegment() {
        LOG.info(() -> "TEST: testWhitespaceIsTrimmedPerSegment");
        assertThat(PathTokenizer.tokenize(" Child . Name ")).containsExactly(
                PathToken.member("Child"), PathToken.member("Name"));
    }

    @Test
    void testEmptySegmentsAreDropped() {
        LOG.info(() -> "TEST: testEmptySegmentsAreDropped");
        assertThat(PathTokenizer.tokenize("..Child...Name..")).containsExactly(
                PathToken.member("Child"), PathToken.member("Name"));
        assertThat(PathTokenizer.tokenize("")).isEmpty();
        assertThat(PathTokenizer.tokenize(" . ")).isEmpty();
    }

    @Test
    void testBareIndexerHasEmptyName() {
        LOG.info(() -> "TEST: testBareIndexerHasEmptyName - [3]");
        final var token = PathTokenizer.tokenize("[3]").get(0);
        assertThat(token.name()).isEmpty();
        assertThat(token.hasName()).isFalse();
        assertThat(token.index()).isEqualTo(3);
    }

    @Test
    void testIndexerContentIsTrimmed() {
        LOG.info(() -> "TEST: testIndexerContentIsTrimmed - Items[ 12 ]");
        assertThat(PathTokenizer.tokenize("Items[ 12 ]")).containsExactly(new PathToken("Items", 12));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Tags[", "Tags]", "Tags[abc]", "Tags[1", "Tags[]", "Tags[-]", "Tags[-1]", "Tags[1.5]",
            "Tags[+1]", "Tags[0x1]", "Tags[1][2]", "Tags[2147483648]"})
    void testMalformedIndexerFoldsIntoName(String segment) {
        LOG.info(() -> "TEST: testMalformedIndexerFoldsIntoName - " + segment);
        assertThat(PathTokenizer.tokenize(segment)).containsExactly(PathToken.member(segment));
    }

    @Test
    void testTokensAreImmutable() {
        LOG.info(() -> "TEST: testTokensAreImmutable");
        final List<PathToken> tokens = PathTokenizer.tokenize("a.b");
        assertThatThrownBy(() -> tokens.add(PathToken.member("c")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testNullPathIsRejected() {
        LOG.info(() -> "TEST: testNullPathIsRejected");
        assertThatThrownBy(() -> PathTokenizer.tokenize(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("path must not be null");
    }

    @Test
    void testTokenValidation() {
        LOG.info(() -> "TEST: testTokenValidation");
        assertThatThrownBy(() -> new PathToken("x", -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PathToken(null, 0)).isInstanceOf(NullPointerException.class);
        assertThat(new PathToken("items", 2)).hasToString("items[2]");
        assertThat(PathToken.member("title")).hasToString("title");
    }
}
