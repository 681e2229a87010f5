package io.b2mash.workhub.fielddefinition;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CustomFieldDefinitionRepository
    extends JpaRepository<CustomFieldDefinition, Long> {

  List<CustomFieldDefinition> findByProjectIdOrderByIdAsc(Long projectId);

  /** Exclusive lock held while the declared type or options change. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT d FROM CustomFieldDefinition d WHERE d.id = :id")
  Optional<CustomFieldDefinition> findByIdForUpdate(@Param("id") Long id);

  /** Shared lock held while a value is written against the declared type. */
  @Lock(LockModeType.PESSIMISTIC_READ)
  @Query("SELECT d FROM CustomFieldDefinition d WHERE d.id = :id")
  Optional<CustomFieldDefinition> findByIdForShare(@Param("id") Long id);
}
