package com.certchaperone.backend.modules.vehicle.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.certchaperone.backend.modules.vehicle.domain.Document;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DocumentRepository extends JpaRepository<Document, UUID> {

    @Query("""
            select d.userId as userId, count(d) as documentCount
            from Document d
            where d.userId in :userIds
            group by d.userId
            """)
    List<UserDocumentCount> countByUserIds(@Param("userIds") Collection<UUID> userIds);

    interface UserDocumentCount {
        UUID getUserId();

        Long getDocumentCount();
    }
}
