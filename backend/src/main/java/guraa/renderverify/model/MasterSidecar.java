package guraa.renderverify.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of {@link MasterMetadata}, stored next to each master image.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MasterSidecar {

    /**
     * Dimension name to the value it had when the master was saved.
     */
    private Map<String, String> description = new LinkedHashMap<>();

    /**
     * Names of the dimensions the master must be matched on.
     */
    private List<String> criteria = new ArrayList<>();
}
