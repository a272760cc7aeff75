package com.reservation.api.service;

import com.reservation.api.entity.AccountRole;
import com.reservation.api.entity.Client;
import com.reservation.api.entity.Company;
import com.reservation.api.exception.BookingException;
import com.reservation.api.exception.BookingException.Reason;
import com.reservation.api.repository.ClientRepository;
import com.reservation.api.repository.CompanyRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Translates an account id plus declared role into the client or company profile behind it.
 */
@Service
public class IdentityService {

    private final ClientRepository clientRepository;
    private final CompanyRepository companyRepository;

    public IdentityService(ClientRepository clientRepository, CompanyRepository companyRepository) {
        this.clientRepository = clientRepository;
        this.companyRepository = companyRepository;
    }

    @Transactional(readOnly = true)
    public Long requireClientId(UUID accountId) {
        return requireClient(accountId).getId();
    }

    @Transactional(readOnly = true)
    public Client requireClient(UUID accountId) {
        return findClient(accountId)
                .orElseThrow(() -> new BookingException(Reason.IDENTITY_NOT_RESOLVED,
                        "No client profile for account " + accountId));
    }

    @Transactional(readOnly = true)
    public Long requireCompanyId(UUID accountId) {
        return findCompany(accountId)
                .map(Company::getId)
                .orElseThrow(() -> new BookingException(Reason.IDENTITY_NOT_RESOLVED,
                        "No company profile for account " + accountId));
    }

    /**
     * Rejects callers whose declared role is not the one an operation is restricted to.
     */
    public void requireRole(AccountRole actual, AccountRole expected) {
        if (actual != expected) {
            throw new BookingException(Reason.ROLE_NOT_PERMITTED,
                    "Operation requires role '" + expected.getValue() + "'");
        }
    }

    @Transactional(readOnly = true)
    public Optional<Client> findClient(UUID accountId) {
        return accountId == null ? Optional.empty() : clientRepository.findByAccountId(accountId);
    }

    @Transactional(readOnly = true)
    public Optional<Company> findCompany(UUID accountId) {
        return accountId == null ? Optional.empty() : companyRepository.findByAccountId(accountId);
    }
}
