package uk.gegc.learnhub.features.catalog.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.learnhub.features.catalog.domain.model.Course;

import java.util.UUID;

public interface CourseRepository extends JpaRepository<Course, UUID> {
}
