package seedrec.clients;

import seedrec.models.ExternalMetadata;
import java.util.Optional;

/**
 * Interface für den (optionalen) Metadaten-Anreicherungsdienst
 */
public interface MetadataEnrichmentClient {

    // year ist optional (null = ohne Jahr suchen)
    Optional<ExternalMetadata> lookup(String title, Integer year) throws ClientException;
}
