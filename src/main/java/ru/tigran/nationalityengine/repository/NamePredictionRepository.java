package ru.tigran.nationalityengine.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.tigran.nationalityengine.model.NamePrediction;

import java.util.Optional;

@Repository
public interface NamePredictionRepository extends JpaRepository<NamePrediction, Long> {
    Optional<NamePrediction> findByNormalizedName(String normalizedName);

    @Modifying
    @Query("DELETE FROM NamePrediction np WHERE np.normalizedName = :normalizedName")
    int deleteByNormalizedName(@Param("normalizedName") String normalizedName);
}
