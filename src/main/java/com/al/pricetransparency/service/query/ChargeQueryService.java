package com.al.pricetransparency.service.query;

import com.al.pricetransparency.dto.PayerSummary;
import com.al.pricetransparency.dto.PriceStats;
import com.al.pricetransparency.model.HospitalDocument;
import com.al.pricetransparency.model.StandardChargeDocument;
import com.al.pricetransparency.model.enums.CodeType;
import com.al.pricetransparency.model.enums.Setting;
import com.al.pricetransparency.repository.HospitalRepository;
import com.al.pricetransparency.repository.StandardChargeRepository;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.TextCriteria;
import org.springframework.data.mongodb.core.query.TextQuery;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-side lookups over the stored charges and hospitals.
 */
@Service
public class ChargeQueryService {

    public static final int DEFAULT_LIMIT = 100;

    private final MongoTemplate mongoTemplate;
    private final StandardChargeRepository chargeRepository;
    private final HospitalRepository hospitalRepository;

    public ChargeQueryService(MongoTemplate mongoTemplate,
            StandardChargeRepository chargeRepository,
            HospitalRepository hospitalRepository) {
        this.mongoTemplate = mongoTemplate;
        this.chargeRepository = chargeRepository;
        this.hospitalRepository = hospitalRepository;
    }

    /**
     * Charges whose primary code, or any of their codes, equals {@code code}.
     *
     * @param codeType  restricts the match to this code system when not null
     * @param hospitalId optional hospital filter
     * @param setting   optional setting filter
     */
    public List<StandardChargeDocument> searchByCode(String code, CodeType codeType, String hospitalId,
            Setting setting, int limit) {
        Criteria primary = Criteria.where("primaryCode").is(code);
        Criteria anyCode;
        if (codeType != null) {
            primary = primary.and("primaryCodeType").is(codeType);
            anyCode = Criteria.where("codes").elemMatch(Criteria.where("code").is(code).and("type").is(codeType));
        } else {
            anyCode = Criteria.where("codes.code").is(code);
        }

        Query query = new Query(new Criteria().orOperator(primary, anyCode));
        applyFilters(query, hospitalId, setting);
        query.limit(limit > 0 ? limit : DEFAULT_LIMIT);
        return mongoTemplate.find(query, StandardChargeDocument.class);
    }

    /**
     * Full-text search over description and hospital name, best matches first.
     */
    public List<StandardChargeDocument> searchByDescription(String text, String hospitalId, Setting setting,
            int limit) {
        Query query = TextQuery.queryText(TextCriteria.forDefaultLanguage().matching(text)).sortByScore();
        applyFilters(query, hospitalId, setting);
        query.limit(limit > 0 ? limit : DEFAULT_LIMIT);
        return mongoTemplate.find(query, StandardChargeDocument.class);
    }

    public PriceStats getPriceStatsByCode(String code, CodeType codeType) {
        List<PriceStats> stats = codeType != null
                ? chargeRepository.priceStatsByPrimaryCode(code, codeType.name())
                : chargeRepository.priceStatsByPrimaryCode(code);
        return stats.isEmpty() ? PriceStats.empty() : stats.get(0);
    }

    public List<PayerSummary> getUniquePayers() {
        return chargeRepository.findUniquePayers();
    }

    public List<HospitalDocument> getAllHospitals() {
        return hospitalRepository.findAllByOrderByHospitalNameAsc();
    }

    public Optional<HospitalDocument> getHospitalById(String hospitalId) {
        return hospitalRepository.findByHospitalId(hospitalId);
    }

    private static void applyFilters(Query query, String hospitalId, Setting setting) {
        if (hospitalId != null && !hospitalId.isBlank()) {
            query.addCriteria(Criteria.where("hospitalId").is(hospitalId));
        }
        if (setting != null) {
            query.addCriteria(Criteria.where("setting").is(setting));
        }
    }
}
