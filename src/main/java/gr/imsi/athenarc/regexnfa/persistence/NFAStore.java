package gr.imsi.athenarc.regexnfa.persistence;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;

/**
 * Reads and writes {@link SavedNFA} records as JSON files.
 */
public class NFAStore {
    private static final Logger LOG = LoggerFactory.getLogger(NFAStore.class);

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public void save(SavedNFA saved, Path file) throws IOException {
        Preconditions.checkNotNull(saved, "Nothing to save");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(file.toFile(), saved);
        LOG.info("Saved NFA (postfix '{}') to {}", saved.getPostfix(), file);
    }

    public SavedNFA load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("No saved NFA at " + file);
        }
        SavedNFA saved = mapper.readValue(file.toFile(), SavedNFA.class);
        if (saved.getTransitions() == null || saved.getStart() == null || saved.getAccept() == null) {
            throw new IOException("Saved NFA at " + file + " is missing transitions or state ids");
        }
        LOG.info("Loaded NFA (postfix '{}') from {}, simulatable: {}", saved.getPostfix(), file, saved.isSimulatable());
        return saved;
    }
}
