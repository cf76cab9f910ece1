package info.mouts.foodorders.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Repository;
import org.springframework.data.jpa.repository.JpaRepository;

import info.mouts.foodorders.domain.AdminAccount;

@Repository
public interface AdminAccountRepository extends JpaRepository<AdminAccount, String> {
    Optional<AdminAccount> findByEmailIgnoreCase(String email);

    List<AdminAccount> findByFcmTokenIsNotNull();
}
