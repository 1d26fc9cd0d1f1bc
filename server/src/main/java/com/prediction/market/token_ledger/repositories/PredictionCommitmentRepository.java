package com.prediction.market.token_ledger.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import com.prediction.market.token_ledger.entity.CommitmentStatus;
import com.prediction.market.token_ledger.entity.PredictionCommitment;

@Repository
public interface PredictionCommitmentRepository extends MongoRepository<PredictionCommitment, String> {

    List<PredictionCommitment> findByUserIdAndStatus(String userId, CommitmentStatus status);

    List<PredictionCommitment> findByPredictionIdAndStatus(String predictionId, CommitmentStatus status);

    /**
     * Atomically move a commitment from the expected status to a terminal one.
     *
     * @return number of documents modified (1 if successful, 0 if status mismatch)
     */
    @Query("{ '_id': ?0, 'status': ?1 }")
    @Update("{ $set: { 'status': ?2, 'resolvedAt': ?3 } }")
    long atomicStatusTransition(String commitmentId, String expectedStatus, String newStatus, long resolvedAt);
}
