package net.moznion.schedsync.expansion;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.junit.Test;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

public class DependencySerializerTest {
    private final DependencySerializer serializer = new DependencySerializer();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void testRewriteMultiUserDependencies() throws Exception {
        final String serialized = serializer.serialize(Arrays.asList("push-granola-tokens", "shared-job"),
                                                       "kyler",
                                                       Collections.singleton("push-granola-tokens"));
        assertThat(parse(serialized)).containsExactly("push-granola-tokens--kyler", "shared-job");
    }

    @Test
    public void testPreserveOrder() throws Exception {
        final String serialized = serializer.serialize(Arrays.asList("c", "a", "b", "a"),
                                                       "lucas",
                                                       new HashSet<>(Arrays.asList("a", "b")));
        assertThat(parse(serialized)).containsExactly("c", "a--lucas", "b--lucas", "a--lucas");
    }

    @Test
    public void testNullDependenciesStayNull() {
        assertThat(serializer.serialize(null, "kyler", Collections.emptySet())).isNull();
        assertThat(serializer.serialize(null, null, Collections.emptySet())).isNull();
    }

    @Test
    public void testEmptyDependencies() throws Exception {
        final String serialized = serializer.serialize(Collections.emptyList(), "kyler", Collections.emptySet());
        assertThat(serialized).isEqualTo("[]");
        assertThat(parse(serialized)).isEmpty();
    }

    @Test
    public void testNonMultiUserDependencyUnchanged() throws Exception {
        final String serialized = serializer.serialize(Collections.singletonList("shared-job"),
                                                       "kyler",
                                                       Collections.singleton("other-job"));
        assertThat(parse(serialized)).containsExactly("shared-job");
    }

    @Test
    public void testNoRewriteWithoutUser() throws Exception {
        final String serialized = serializer.serialize(Collections.singletonList("push-granola-tokens"),
                                                       null,
                                                       Collections.singleton("push-granola-tokens"));
        assertThat(parse(serialized)).containsExactly("push-granola-tokens");
    }

    @Test
    public void testCompactJsonText() {
        final String serialized = serializer.serialize(Collections.singletonList("push-granola-tokens"),
                                                       "kyler",
                                                       Collections.singleton("push-granola-tokens"));
        assertThat(serialized).isEqualTo("[\"push-granola-tokens--kyler\"]");
    }

    @Test
    public void testNullMultiUserNamesTreatedAsEmpty() throws Exception {
        final String serialized = serializer.serialize(Collections.singletonList("a"), "kyler", null);
        assertThat(parse(serialized)).containsExactly("a");
    }

    private List<String> parse(final String serialized) throws Exception {
        return mapper.readValue(serialized, new TypeReference<List<String>>() {});
    }
}
