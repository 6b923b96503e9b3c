package io.vidsort4j.store;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryProposedTagLog implements ProposedTagLog {

    private final List<ProposedTag> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(ProposedTag tag) {
        entries.add(tag);
    }

    @Override
    public List<ProposedTag> entries() {
        return List.copyOf(entries);
    }
}
