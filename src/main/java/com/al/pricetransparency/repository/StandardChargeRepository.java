package com.al.pricetransparency.repository;

import com.al.pricetransparency.dto.PayerSummary;
import com.al.pricetransparency.dto.PriceStats;
import com.al.pricetransparency.model.StandardChargeDocument;
import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StandardChargeRepository extends MongoRepository<StandardChargeDocument, String> {

        @Aggregation(pipeline = {
                        "{ $match: { primaryCode: ?0 } }",
                        "{ $group: { _id: null, count: { $sum: 1 }, avgGross: { $avg: '$grossCharge' }, "
                                        + "minGross: { $min: '$grossCharge' }, maxGross: { $max: '$grossCharge' }, "
                                        + "avgDiscounted: { $avg: '$discountedCash' } } }"
        })
        List<PriceStats> priceStatsByPrimaryCode(String code);

        @Aggregation(pipeline = {
                        "{ $match: { primaryCode: ?0, primaryCodeType: ?1 } }",
                        "{ $group: { _id: null, count: { $sum: 1 }, avgGross: { $avg: '$grossCharge' }, "
                                        + "minGross: { $min: '$grossCharge' }, maxGross: { $max: '$grossCharge' }, "
                                        + "avgDiscounted: { $avg: '$discountedCash' } } }"
        })
        List<PriceStats> priceStatsByPrimaryCode(String code, String codeType);

        @Aggregation(pipeline = {
                        "{ $unwind: '$payerCharges' }",
                        "{ $group: { _id: '$payerCharges.payerName', plans: { $addToSet: '$payerCharges.planName' } } }",
                        "{ $project: { _id: 0, payerName: '$_id', planCount: { $size: '$plans' } } }",
                        "{ $sort: { planCount: -1 } }"
        })
        List<PayerSummary> findUniquePayers();
}
