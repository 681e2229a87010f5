package io.b2mash.workhub.account;

import io.b2mash.workhub.exception.ResourceNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountService {

  private final AccountRepository accountRepository;

  public AccountService(AccountRepository accountRepository) {
    this.accountRepository = accountRepository;
  }

  @Transactional(readOnly = true)
  public Account getAccount(long accountId) {
    return accountRepository
        .findById(accountId)
        .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
  }
}
