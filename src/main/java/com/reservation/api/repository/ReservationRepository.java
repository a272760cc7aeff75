package com.reservation.api.repository;

import com.reservation.api.entity.Reservation;
import com.reservation.api.entity.ReservationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    @Query("SELECT r FROM Reservation r WHERE r.employee.id = :employeeId "
            + "AND r.startTime >= :dayStart AND r.startTime < :dayEnd "
            + "AND r.status NOT IN :excluded ORDER BY r.startTime ASC")
    List<Reservation> findBookedForEmployeeBetween(@Param("employeeId") Long employeeId,
                                                   @Param("dayStart") LocalDateTime dayStart,
                                                   @Param("dayEnd") LocalDateTime dayEnd,
                                                   @Param("excluded") Collection<ReservationStatus> excluded);

    @Query("SELECT CASE WHEN COUNT(r) > 0 THEN true ELSE false END FROM Reservation r "
            + "WHERE r.employee.id = :employeeId AND r.status NOT IN :excluded "
            + "AND r.startTime < :end AND r.endTime > :start")
    boolean existsOverlapping(@Param("employeeId") Long employeeId,
                              @Param("start") LocalDateTime start,
                              @Param("end") LocalDateTime end,
                              @Param("excluded") Collection<ReservationStatus> excluded);

    List<Reservation> findByClientId(Long clientId);

    List<Reservation> findByCompanyId(Long companyId);

    List<Reservation> findByEmployeeId(Long employeeId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reservation r WHERE r.id = :id")
    Optional<Reservation> findByIdForUpdate(@Param("id") Long id);
}
