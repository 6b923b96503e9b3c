package io.vidsort4j.store;

import java.util.List;

/**
 * Append-only log of unknown labels seen in extractor hints.
 */
public interface ProposedTagLog {

    void append(ProposedTag tag);

    List<ProposedTag> entries();
}
