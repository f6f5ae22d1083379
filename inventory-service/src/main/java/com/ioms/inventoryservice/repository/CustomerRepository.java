package com.ioms.inventoryservice.repository;

import com.ioms.inventoryservice.model.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CustomerRepository extends JpaRepository<Customer, UUID> {

    boolean existsByEmailIgnoreCase(String email);

    List<Customer> findAllByOrderByFullNameAsc();
}
