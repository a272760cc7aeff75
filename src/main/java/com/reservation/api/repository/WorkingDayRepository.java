package com.reservation.api.repository;

import com.reservation.api.entity.WorkingDay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;

@Repository
public interface WorkingDayRepository extends JpaRepository<WorkingDay, Long> {

    Optional<WorkingDay> findByCompanyIdAndDay(Long companyId, DayOfWeek day);

    List<WorkingDay> findByCompanyId(Long companyId);
}
