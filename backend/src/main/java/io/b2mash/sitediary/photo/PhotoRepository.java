package io.b2mash.sitediary.photo;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PhotoRepository extends JpaRepository<Photo, UUID> {

  /** Chronological order, used by reports. */
  List<Photo> findByProjectIdOrderByDateTakenAscCreatedAtAsc(UUID projectId);

  /** Newest first, used by the gallery listing. */
  List<Photo> findByProjectIdOrderByDateTakenDescCreatedAtDesc(UUID projectId);

  Optional<Photo> findByIdAndProjectId(UUID id, UUID projectId);

  long countByProjectId(UUID projectId);
}
