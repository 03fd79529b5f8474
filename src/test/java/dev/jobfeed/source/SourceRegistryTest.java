package dev.jobfeed.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SourceRegistryTest {

    private static JobSource source(String name) {
        JobSource source = mock(JobSource.class);
        when(source.getName()).thenReturn(name);
        return source;
    }

    @Test
    @DisplayName("Should find sources by name ignoring case")
    void shouldFindIgnoringCase() {
        JobSource jsearch = source("jsearch");
        SourceRegistry registry = new SourceRegistry(List.of(jsearch, source("careerjet")));

        assertThat(registry.find("JSearch")).contains(jsearch);
        assertThat(registry.find("indeed")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    @DisplayName("Should list names in a stable order")
    void shouldListSortedNames() {
        SourceRegistry registry = new SourceRegistry(List.of(source("serpapi"), source("careerjet"), source("jsearch")));

        assertThat(registry.names()).containsExactly("careerjet", "jsearch", "serpapi");
    }

    @Test
    @DisplayName("Should refuse two sources with the same name")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> new SourceRegistry(List.of(source("jsearch"), source("JSearch"))))
                .isInstanceOf(IllegalStateException.class);
    }
}
