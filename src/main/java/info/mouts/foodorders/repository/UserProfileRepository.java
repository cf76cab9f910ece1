package info.mouts.foodorders.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import info.mouts.foodorders.domain.UserProfile;

@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, String> {
}
