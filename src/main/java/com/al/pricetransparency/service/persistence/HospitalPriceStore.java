package com.al.pricetransparency.service.persistence;

import com.al.pricetransparency.model.HospitalDocument;
import com.al.pricetransparency.model.ModifierDocument;
import com.al.pricetransparency.model.StandardChargeDocument;
import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Batch writes of hospitals, charges and modifiers.
 *
 * <p>
 * Bulk writes are unordered: one rejected document does not stop the others, and
 * rejected documents are only counted. Nothing here retries.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HospitalPriceStore {

    private final MongoTemplate mongoTemplate;

    /**
     * Writes a batch of charges. With {@code upsert} each document replaces the stored
     * charge of the same hospital, description, setting and primary code; without it
     * every document is inserted as new.
     */
    public BulkWriteSummary writeCharges(List<StandardChargeDocument> documents, boolean upsert) {
        if (documents.isEmpty()) {
            return BulkWriteSummary.empty();
        }
        BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, StandardChargeDocument.class);
        if (upsert) {
            for (StandardChargeDocument document : documents) {
                bulk.upsert(chargeKeyQuery(document), setAll(document));
            }
        } else {
            bulk.insert(documents);
        }
        return execute(bulk, "charges");
    }

    public BulkWriteSummary upsertModifiers(List<ModifierDocument> documents) {
        if (documents.isEmpty()) {
            return BulkWriteSummary.empty();
        }
        BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, ModifierDocument.class);
        for (ModifierDocument document : documents) {
            Query query = new Query(Criteria.where("hospitalId").is(document.getHospitalId())
                    .and("code").is(document.getCode()));
            bulk.upsert(query, setAll(document));
        }
        return execute(bulk, "modifiers");
    }

    /**
     * @return true when the hospital document was created or changed
     */
    public boolean upsertHospital(HospitalDocument hospital) {
        Query query = new Query(Criteria.where("hospitalId").is(hospital.getHospitalId()));
        UpdateResult result = mongoTemplate.upsert(query, setAll(hospital), HospitalDocument.class);
        return result.getUpsertedId() != null || result.getModifiedCount() > 0;
    }

    public long deleteHospitalCharges(String hospitalId) {
        DeleteResult result = mongoTemplate.remove(
                new Query(Criteria.where("hospitalId").is(hospitalId)), StandardChargeDocument.class);
        log.info("Deleted {} charges of hospital {}", result.getDeletedCount(), hospitalId);
        return result.getDeletedCount();
    }

    public long deleteHospitalModifiers(String hospitalId) {
        DeleteResult result = mongoTemplate.remove(
                new Query(Criteria.where("hospitalId").is(hospitalId)), ModifierDocument.class);
        return result.getDeletedCount();
    }

    public boolean hasCharges(String hospitalId) {
        return mongoTemplate.exists(new Query(Criteria.where("hospitalId").is(hospitalId)),
                StandardChargeDocument.class);
    }

    public CollectionStats getCollectionStats() {
        return new CollectionStats(
                mongoTemplate.count(new Query(), HospitalDocument.class),
                mongoTemplate.count(new Query(), StandardChargeDocument.class),
                mongoTemplate.count(new Query(), ModifierDocument.class));
    }

    static Query chargeKeyQuery(StandardChargeDocument document) {
        return new Query(Criteria.where("hospitalId").is(document.getHospitalId())
                .and("description").is(document.getDescription())
                .and("setting").is(document.getSetting())
                .and("primaryCode").is(document.getPrimaryCode())
                .and("primaryCodeType").is(document.getPrimaryCodeType()));
    }

    /**
     * A {@code $set} of every mapped field except the id, so an upsert never rewrites {@code _id}.
     */
    private Update setAll(Object entity) {
        Document mapped = new Document();
        mongoTemplate.getConverter().write(entity, mapped);
        mapped.remove("_id");
        Update update = new Update();
        mapped.forEach(update::set);
        return update;
    }

    private BulkWriteSummary execute(BulkOperations bulk, String what) {
        try {
            BulkWriteResult result = bulk.execute();
            return new BulkWriteSummary(result.getInsertedCount() + result.getUpserts().size(),
                    result.getModifiedCount(), 0);
        } catch (BulkOperationException e) {
            BulkWriteResult partial = e.getResult();
            int errors = e.getErrors().size();
            log.warn("Bulk write of {} finished with {} rejected documents: {}", what, errors,
                    e.getErrors().isEmpty() ? e.getMessage() : e.getErrors().get(0).getMessage());
            return new BulkWriteSummary(partial.getInsertedCount() + partial.getUpserts().size(),
                    partial.getModifiedCount(), errors);
        }
    }
}
