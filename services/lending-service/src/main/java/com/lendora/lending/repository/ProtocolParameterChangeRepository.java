package com.lendora.lending.repository;

import com.lendora.lending.domain.ProtocolParameterChange;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProtocolParameterChangeRepository extends JpaRepository<ProtocolParameterChange, Long> {

    List<ProtocolParameterChange> findAllByOrderByVersionNumberAscIdAsc();
}
