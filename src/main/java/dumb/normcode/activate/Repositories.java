package dumb.normcode.activate;

import com.fasterxml.jackson.core.type.TypeReference;
import dumb.normcode.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static dumb.normcode.Log.message;

/** The compiler's output and the engine's input: the concept and inference repositories. */
public record Repositories(List<ConceptRecord> concepts, List<InferenceRecord> inferences) {

    public static final String CONCEPT_REPO = "concept_repo.json";
    public static final String INFERENCE_REPO = "inference_repo.json";

    public Repositories {
        concepts = List.copyOf(concepts);
        inferences = inferences.stream().sorted().toList();
    }

    public ConceptTable table() {
        return new ConceptTable(concepts);
    }

    public void write(Path dir) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(CONCEPT_REPO), Json.str(concepts));
        Files.writeString(dir.resolve(INFERENCE_REPO), Json.str(inferences));
        message("Wrote " + concepts.size() + " concepts and " + inferences.size() + " inferences to " + dir);
    }

    public static Repositories read(Path dir) throws IOException {
        List<ConceptRecord> concepts = Json.the.readValue(Files.readString(dir.resolve(CONCEPT_REPO)), new TypeReference<>() {
        });
        List<InferenceRecord> inferences = Json.the.readValue(Files.readString(dir.resolve(INFERENCE_REPO)), new TypeReference<>() {
        });
        return new Repositories(concepts, inferences);
    }
}
