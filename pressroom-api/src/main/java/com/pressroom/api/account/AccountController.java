package com.pressroom.api.account;

import com.pressroom.api.read.AccountView;
import com.pressroom.api.read.ReadCoordinator;
import com.pressroom.api.write.WriteCoordinator;
import com.pressroom.core.domain.Account;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for accounts.
 */
@RestController
@RequestMapping("/api/v1/accounts")
public class AccountController {

    private final WriteCoordinator writeCoordinator;
    private final ReadCoordinator readCoordinator;

    public AccountController(WriteCoordinator writeCoordinator, ReadCoordinator readCoordinator) {
        this.writeCoordinator = writeCoordinator;
        this.readCoordinator = readCoordinator;
    }

    /**
     * Register an account.
     * POST /api/v1/accounts
     */
    @PostMapping
    public ResponseEntity<Account> createAccount(@RequestBody AccountRequest request) {
        Account account = writeCoordinator.createAccount(request.firstName(), request.lastName(), request.email());
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @GetMapping
    public ResponseEntity<List<Account>> listAccounts() {
        return ResponseEntity.ok(readCoordinator.listAccounts());
    }

    /**
     * Account with its profile and content.
     * GET /api/v1/accounts/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<AccountView> getAccount(@PathVariable Long id) {
        return ResponseEntity.ok(readCoordinator.getAccountById(id));
    }

    /**
     * Update the fields present in the body.
     * PUT /api/v1/accounts/{id}
     */
    @PutMapping("/{id}")
    public ResponseEntity<Account> updateAccount(@PathVariable Long id, @RequestBody AccountRequest request) {
        Account account = writeCoordinator.updateAccount(
                id, request.firstName(), request.lastName(), request.email());
        return ResponseEntity.ok(account);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAccount(@PathVariable Long id) {
        writeCoordinator.deleteAccount(id);
        return ResponseEntity.noContent().build();
    }

    // Request DTOs
    public record AccountRequest(String firstName, String lastName, String email) {}
}
