package com.retailsales.infrastructure.persistence.repository;

import com.retailsales.infrastructure.persistence.entity.CsvUploadEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CsvUploadRepository extends JpaRepository<CsvUploadEntity, UUID> {

    List<CsvUploadEntity> findTop20ByOrderByUploadedAtDesc();

    List<CsvUploadEntity> findByStatusOrderByUploadedAtAsc(CsvUploadEntity.UploadStatus status);
}
