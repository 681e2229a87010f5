package io.b2mash.workhub.account;

import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.identity.RequestScopes;
import java.time.Instant;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/api/users", "/mcp/users"})
public class AccountController {

  private final AccountService accountService;

  public AccountController(AccountService accountService) {
    this.accountService = accountService;
  }

  @GetMapping("/me")
  public ResponseEntity<AccountResponse> getCurrentAccount() {
    Principal principal = RequestScopes.requirePrincipal();
    return ResponseEntity.ok(
        AccountResponse.from(accountService.getAccount(principal.accountId()), principal));
  }

  @GetMapping("/{id}")
  public ResponseEntity<AccountResponse> getAccount(@PathVariable long id) {
    Principal principal = RequestScopes.requirePrincipal();
    return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(id), principal));
  }

  public record AccountResponse(
      Long id, String email, String name, boolean administrator, Instant createdAt) {

    public static AccountResponse from(Account account, Principal principal) {
      boolean administrator = principal.isAccount(account.getId()) && principal.administrator();
      return new AccountResponse(
          account.getId(),
          account.getEmail(),
          account.getName(),
          administrator,
          account.getCreatedAt());
    }
  }
}
