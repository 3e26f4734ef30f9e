package com.company.footprint.identity;

import com.company.footprint.config.FootprintProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EbiSearchIdentityDirectoryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EbiSearchIdentityDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new EbiSearchIdentityDirectory(new RestTemplateBuilder(), objectMapper,
                new SimpleMeterRegistry(), new FootprintProperties());
    }

    @Test
    void picksTheExactEmailMatch() throws Exception {
        String payload = """
                {"entries": [
                  {"fields": {"email": ["alice.smith@ebi.ac.uk"], "full_name": ["Alice Smith"],
                              "positions": ["Director|Board"], "photo": []}},
                  {"fields": {"email": ["alice@ebi.ac.uk"], "full_name": ["Alice Liddell"],
                              "positions": ["Staff Association Representative|Staff Association",
                                            "Postdoctoral Fellow|Genomics Team",
                                            "Visiting Scientist|Proteomics Team"],
                              "photo": ["https://example.org/alice.jpg"]}}
                ]}
                """;

        Optional<IdentityRecord> found = directory.parse("alice", objectMapper.readTree(payload));

        assertThat(found).isPresent();
        IdentityRecord identity = found.get();
        assertThat(identity.getName()).isEqualTo("Alice Liddell");
        assertThat(identity.getPosition()).isEqualTo("Postdoctoral Fellow");
        assertThat(identity.getTeams()).containsExactly("Genomics Team", "Proteomics Team");
        assertThat(identity.getPhotoUrl()).isEqualTo("https://example.org/alice.jpg");
    }

    @Test
    void noExactMatchIsEmpty() throws Exception {
        String payload = """
                {"entries": [{"fields": {"email": ["alice.smith@ebi.ac.uk"], "full_name": ["Alice Smith"]}}]}
                """;

        assertThat(directory.parse("alice", objectMapper.readTree(payload))).isEmpty();
        assertThat(directory.parse("alice", objectMapper.readTree("{}"))).isEmpty();
    }

    @Test
    void entriesWithoutPositionsHaveNoTeams() throws Exception {
        String payload = """
                {"entries": [{"fields": {"email": ["bob@ebi.ac.uk"], "full_name": ["Bob"]}}]}
                """;

        IdentityRecord identity = directory.parse("bob", objectMapper.readTree(payload)).orElseThrow();

        assertThat(identity.getPosition()).isNull();
        assertThat(identity.getTeams()).isEmpty();
        assertThat(identity.getPhotoUrl()).isNull();
    }
}
