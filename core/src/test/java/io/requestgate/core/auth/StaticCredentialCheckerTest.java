package io.requestgate.core.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StaticCredentialChecker")
class StaticCredentialCheckerTest {

    @Test
    @DisplayName("accepts exact user and password only")
    void exactMatch() {
        StaticCredentialChecker checker = new StaticCredentialChecker(Map.of("alice", "pw", "bob", "Pw"));

        assertThat(checker.check("alice", "pw")).isTrue();
        assertThat(checker.check("bob", "Pw")).isTrue();
        assertThat(checker.check("alice", "Pw")).isFalse();
        assertThat(checker.check("Alice", "pw")).isFalse();
        assertThat(checker.check("carol", "pw")).isFalse();
        assertThat(checker.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("later changes to the source map are not seen")
    void copiesUsers() {
        Map<String, String> users = new HashMap<>(Map.of("alice", "pw"));
        StaticCredentialChecker checker = new StaticCredentialChecker(users);

        users.put("mallory", "x");

        assertThat(checker.check("mallory", "x")).isFalse();
    }
}
