package com.example.styleverify.repository;

import com.example.styleverify.model.VerificationResult;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Verification runs with their embedded mismatches (collection verification_results).
 */
public interface VerificationResultRepository extends MongoRepository<VerificationResult, String> {

    boolean existsByTemplateId(String templateId);

    List<VerificationResult> findByTemplateIdOrderByVerificationDateDesc(String templateId);
}
