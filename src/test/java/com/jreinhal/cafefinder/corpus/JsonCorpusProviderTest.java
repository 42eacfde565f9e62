package com.jreinhal.cafefinder.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.cafefinder.exception.CorpusLoadException;
import com.jreinhal.cafefinder.model.LopSession;
import com.jreinhal.cafefinder.model.Person;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class JsonCorpusProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final DefaultResourceLoader resourceLoader = new DefaultResourceLoader();

    @TempDir
    Path dir;

    private <T> JsonCorpusProvider<T> provider(Path file, Class<T> type) {
        return new JsonCorpusProvider<>(this.resourceLoader, "file:" + file.toAbsolutePath(), this.objectMapper, type);
    }

    @Test
    @DisplayName("Should read records, skipping nulls and unknown fields")
    void shouldReadRecords() throws IOException {
        Path file = this.dir.resolve("people.json");
        Files.writeString(file, """
                [
                  {"id": "user-9", "displayName": "Ana Ruiz", "team": "Design", "isActive": false, "favouriteColour": "teal"},
                  null,
                  {"id": "user-10", "displayName": "Ben Ito"}
                ]
                """, StandardCharsets.UTF_8);

        List<Person> people = provider(file, Person.class).listCurrent();

        assertThat(people).extracting(Person::id).containsExactly("user-9", "user-10");
        assertEquals(Boolean.FALSE, people.get(0).active());
        assertEquals(Boolean.TRUE, people.get(1).active());
        assertThat(people.get(1).expertiseAreas()).isEmpty();
    }

    @Test
    @DisplayName("Should parse ISO dates")
    void shouldParseDates() throws IOException {
        Path file = this.dir.resolve("lop-sessions.json");
        Files.writeString(file, """
                [{"id": "lop-7", "sessionNumber": 7, "title": "Pricing", "date": "2026-05-14", "speakerIds": ["user-1"]}]
                """, StandardCharsets.UTF_8);

        List<LopSession> sessions = provider(file, LopSession.class).listCurrent();

        assertEquals(LocalDate.of(2026, 5, 14), sessions.get(0).date());
    }

    @Test
    @DisplayName("Should treat a missing file as an empty category")
    void shouldTreatMissingFileAsEmpty() {
        assertTrue(provider(this.dir.resolve("absent.json"), Person.class).listCurrent().isEmpty());
    }

    @Test
    @DisplayName("Should fail loudly on malformed JSON")
    void shouldRejectMalformedJson() throws IOException {
        Path file = this.dir.resolve("broken.json");
        Files.writeString(file, "[{\"id\": ", StandardCharsets.UTF_8);

        CorpusLoadException e = assertThrows(CorpusLoadException.class, () -> provider(file, Person.class).listCurrent());

        assertThat(e.getMessage()).contains("broken.json");
    }

    @Test
    @DisplayName("Should load the bundled sample corpus from the classpath")
    void shouldLoadBundledCorpus() {
        JsonCorpusProvider<Person> bundled = new JsonCorpusProvider<>(this.resourceLoader, "classpath:corpus/people.json",
                this.objectMapper, Person.class);

        List<Person> people = bundled.listCurrent();

        assertEquals(4, people.size());
        assertEquals("Sarah Chen", people.get(0).displayName());
    }
}
