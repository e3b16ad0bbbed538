package io.b2mash.sitediary.entry;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DiaryEntryRepository extends JpaRepository<DiaryEntry, UUID> {

  /** Chronological order, used by reports. */
  List<DiaryEntry> findByProjectIdOrderByDateAscCreatedAtAsc(UUID projectId);

  /** Newest first, used by the listing endpoint. */
  List<DiaryEntry> findByProjectIdOrderByDateDescCreatedAtDesc(UUID projectId);

  Optional<DiaryEntry> findByIdAndProjectId(UUID id, UUID projectId);

  long countByProjectId(UUID projectId);

  @Modifying
  @Query("DELETE FROM DiaryEntry e WHERE e.projectId = :projectId")
  int deleteAllByProjectId(@Param("projectId") UUID projectId);
}
