package com.al.pricetransparency.repository;

import com.al.pricetransparency.model.HospitalDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface HospitalRepository extends MongoRepository<HospitalDocument, String> {
    Optional<HospitalDocument> findByHospitalId(String hospitalId);

    List<HospitalDocument> findAllByOrderByHospitalNameAsc();

    boolean existsByHospitalId(String hospitalId);
}
