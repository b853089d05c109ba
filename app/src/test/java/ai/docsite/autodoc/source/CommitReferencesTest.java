package ai.docsite.autodoc.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CommitReferencesTest {

    @ParameterizedTest
    @ValueSource(strings = {"abcde", "0123456789abcdef0123456789abcdef01234567", "3f2a9c1"})
    void acceptsHexRevisions(String commitId) {
        assertThat(CommitReferences.isValid(commitId)).isTrue();
        assertThat(CommitReferences.requireValid(commitId)).isEqualTo(commitId);
    }

    @ParameterizedTest
    @ValueSource(strings = {"[commit_id]", "test_commit_id", "actual-commit_id", "[example_commit_id]",
            "abcd", "ABCDEF1", "g123456", "0123456789abcdef0123456789abcdef012345678", " abc1234"})
    void rejectsPlaceholdersAndMalformedRevisions(String commitId) {
        assertThat(CommitReferences.isValid(commitId)).isFalse();
        assertThatThrownBy(() -> CommitReferences.requireValid(commitId)).isInstanceOf(InvalidReferenceException.class);
    }

    @Test
    void rejectsBlank() {
        assertThat(CommitReferences.isValid(null)).isFalse();
        assertThatThrownBy(() -> CommitReferences.requireValid("  "))
                .isInstanceOf(InvalidReferenceException.class)
                .hasMessageContaining("required");
    }
}
