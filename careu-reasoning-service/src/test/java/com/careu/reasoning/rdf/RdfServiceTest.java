package com.careu.reasoning.rdf;

import com.careu.reasoning.TestFacts;
import com.careu.reasoning.exception.FactStoreLoadException;
import com.careu.reasoning.repository.FactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class RdfServiceTest {

    private RdfService service;

    @BeforeEach
    void setUp() {
        service = new RdfService(
                new ClassPathResource(TestFacts.DATA_FILE),
                new ClassPathResource(TestFacts.SHAPES_FILE));
        service.loadRdfOnStartup();
    }

    @Test
    void startupLoad_servesGenerationOne() {
        FactStore store = service.snapshot();

        assertThat(store.generation()).isEqualTo(1);
        assertThat(store.findCondition("meningitis")).isPresent();
    }

    @Test
    void reload_swapsInNewGeneration() {
        FactStore before = service.snapshot();

        FactStore after = service.reload();

        assertThat(after.generation()).isEqualTo(2);
        assertThat(service.snapshot()).isSameAs(after);
        assertThat(before.generation()).isEqualTo(1);
        assertThat(after.size()).isEqualTo(before.size());
    }

    @Test
    void failedReload_keepsPreviousSnapshot() {
        FactStore before = service.snapshot();
        ByteArrayResource broken = new ByteArrayResource(
                (TestFacts.PREFIXES + "id:flu a kb:Condition").getBytes(StandardCharsets.UTF_8), "broken fixture");

        assertThatThrownBy(() -> service.reload(broken))
                .isInstanceOf(FactStoreLoadException.class);

        assertThat(service.snapshot()).isSameAs(before);
        assertThat(service.reload().generation()).isEqualTo(2);
    }

    @Test
    void snapshot_beforeLoad_isLoadError() {
        RdfService unloaded = new RdfService(
                new ClassPathResource(TestFacts.DATA_FILE),
                new ClassPathResource(TestFacts.SHAPES_FILE));

        assertThatThrownBy(unloaded::snapshot)
                .isInstanceOf(FactStoreLoadException.class);
    }
}
