package com.al.pricetransparency.config;

import com.al.pricetransparency.model.HospitalDocument;
import com.al.pricetransparency.model.ModifierDocument;
import com.al.pricetransparency.model.PricingCacheDocument;
import com.al.pricetransparency.model.StandardChargeDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.IndexResolver;
import org.springframework.data.mongodb.core.index.MongoPersistentEntityIndexResolver;
import org.springframework.data.mongodb.core.index.TextIndexDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates the indexes of the ingestion and cache collections: those declared on the
 * document classes plus the query indexes below. Automatic index creation is disabled,
 * so this is called explicitly by the ingestion entry points. Safe to call repeatedly.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CollectionInitializer {

    private final MongoTemplate mongoTemplate;

    public void initialize() {
        log.info("Initializing hospital price collections...");

        ensure(HospitalDocument.class, List.of(
                new TextIndexDefinition.TextIndexDefinitionBuilder()
                        .onField("hospitalName").named("hospital_name_text_idx").build(),
                new Index().on("addresses", Sort.Direction.ASC),
                new Index().on("licenseState", Sort.Direction.ASC),
                new Index().on("npiNumbers", Sort.Direction.ASC),
                new Index().on("ingestedAt", Sort.Direction.DESC)));

        ensure(StandardChargeDocument.class, List.of(
                new Index().on("hospitalId", Sort.Direction.ASC)
                        .on("primaryCode", Sort.Direction.ASC)
                        .on("primaryCodeType", Sort.Direction.ASC),
                new Index().on("codes.code", Sort.Direction.ASC).on("codes.type", Sort.Direction.ASC),
                new TextIndexDefinition.TextIndexDefinitionBuilder()
                        .onField("description").onField("hospitalName").named("description_text_idx").build(),
                new Index().on("setting", Sort.Direction.ASC),
                new Index().on("grossCharge", Sort.Direction.ASC),
                new Index().on("discountedCash", Sort.Direction.ASC),
                new Index().on("payerCharges.payerName", Sort.Direction.ASC),
                new Index().on("payerCharges.planName", Sort.Direction.ASC),
                new Index().on("hospitalId", Sort.Direction.ASC).on("ingestedAt", Sort.Direction.DESC),
                new Index().on("drugType", Sort.Direction.ASC)));

        ensure(ModifierDocument.class, List.of(
                new Index().on("code", Sort.Direction.ASC)));

        ensure(PricingCacheDocument.class, List.of(
                new Index().on("createdAt", Sort.Direction.DESC),
                new Index().on("hitCount", Sort.Direction.DESC)));

        log.info("Hospital price collections initialized.");
    }

    private void ensure(Class<?> entityClass, List<IndexDefinition> indexes) {
        IndexOperations indexOps = mongoTemplate.indexOps(entityClass);
        IndexResolver resolver = new MongoPersistentEntityIndexResolver(
                mongoTemplate.getConverter().getMappingContext());
        List<IndexDefinition> all = new ArrayList<>();
        resolver.resolveIndexFor(entityClass).forEach(all::add);
        all.addAll(indexes);
        for (IndexDefinition index : all) {
            try {
                indexOps.ensureIndex(index);
            } catch (RuntimeException e) {
                // Usually an equivalent index created under another name
                log.info("Index creation note for {}: {}", entityClass.getSimpleName(), e.getMessage());
            }
        }
    }
}
