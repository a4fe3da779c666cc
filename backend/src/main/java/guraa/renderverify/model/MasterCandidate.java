package guraa.renderverify.model;

import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * A stored master image available for matching.
 */
@Value
public class MasterCandidate {

    @NonNull
    Path file;

    @NonNull
    MasterMetadata metadata;

    public String getFileName() {
        return file.getFileName().toString();
    }
}
