package com.flamingo.ai.contextengine.domain.repository;

import com.flamingo.ai.contextengine.domain.entity.UserProfile;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for UserProfile entities. */
@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, String> {

  /** Loads the profiles of all given users in one query. */
  List<UserProfile> findByUserIdIn(Collection<String> userIds);
}
