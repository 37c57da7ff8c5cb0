package com.wraft.doc.repository;

import com.wraft.doc.model.ContentType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ContentTypeRepository extends JpaRepository<ContentType, Long> {

    Optional<ContentType> findByUuid(String uuid);
}
