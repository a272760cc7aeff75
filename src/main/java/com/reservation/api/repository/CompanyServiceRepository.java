package com.reservation.api.repository;

import com.reservation.api.entity.CompanyService;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyServiceRepository extends JpaRepository<CompanyService, Long> {

    Optional<CompanyService> findByIdAndCompanyId(Long id, Long companyId);

    @Query("SELECT CASE WHEN COUNT(e) > 0 THEN true ELSE false END "
            + "FROM CompanyService s JOIN s.employees e WHERE s.id = :serviceId AND e.id = :employeeId")
    boolean isEmployeeAssigned(@Param("serviceId") Long serviceId, @Param("employeeId") Long employeeId);
}
