package io.vidsort4j.internal.mongo;

import io.vidsort4j.store.ProposedTag;
import io.vidsort4j.store.ProposedTagLog;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Objects;

/**
 * Proposed-tag log stored in the {@code proposed_tags} collection, oldest first.
 */
public class MongoProposedTagLog implements ProposedTagLog {

    private final MongoTemplate mongoTemplate;

    public MongoProposedTagLog(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void append(ProposedTag tag) {
        Objects.requireNonNull(tag, "tag must not be null");
        ProposedTagDocument doc = new ProposedTagDocument();
        doc.setLabel(tag.label());
        doc.setSource(tag.source());
        doc.setConfidence(tag.confidence());
        doc.setJobUrl(tag.jobUrl());
        doc.setAt(tag.at());
        mongoTemplate.insert(doc);
    }

    @Override
    public List<ProposedTag> entries() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("at"), Sort.Order.asc("_id")));
        return mongoTemplate.find(q, ProposedTagDocument.class).stream()
                .map(d -> new ProposedTag(d.getLabel(), d.getSource(), d.getConfidence(), d.getJobUrl(), d.getAt()))
                .toList();
    }
}
