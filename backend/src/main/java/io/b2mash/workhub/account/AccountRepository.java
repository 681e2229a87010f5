package io.b2mash.workhub.account;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, Long> {

  Optional<Account> findBySubject(String subject);

  @Query("SELECT a FROM Account a WHERE LOWER(a.email) = LOWER(:email)")
  Optional<Account> findByEmailIgnoreCase(@Param("email") String email);
}
