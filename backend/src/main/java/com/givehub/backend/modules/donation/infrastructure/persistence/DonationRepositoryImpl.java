package com.givehub.backend.modules.donation.infrastructure.persistence;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.givehub.backend.modules.donation.domain.Donation;
import com.givehub.backend.modules.donation.domain.DonationMethod;
import com.givehub.backend.modules.donation.domain.DonationStatus;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

public class DonationRepositoryImpl implements DonationRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<Donation> search(DonationStatus status, DonationMethod method, UUID campaignId, Pageable pageable) {
        StringBuilder where = new StringBuilder(" where 1 = 1");
        Map<String, Object> params = new LinkedHashMap<>();

        if (status != null) {
            where.append(" and d.status = :status");
            params.put("status", status);
        }
        if (method != null) {
            where.append(" and d.method = :method");
            params.put("method", method);
        }
        if (campaignId != null) {
            where.append(" and d.campaign.id = :campaignId");
            params.put("campaignId", campaignId);
        }

        TypedQuery<Donation> query = entityManager.createQuery(
                "select d from Donation d join fetch d.campaign join fetch d.donor" + where
                        + " order by d.createdAt desc, d.id desc",
                Donation.class);
        TypedQuery<Long> countQuery = entityManager.createQuery("select count(d) from Donation d" + where, Long.class);
        params.forEach((name, value) -> {
            query.setParameter(name, value);
            countQuery.setParameter(name, value);
        });

        query.setFirstResult(Math.toIntExact(pageable.getOffset()));
        query.setMaxResults(pageable.getPageSize());

        List<Donation> content = query.getResultList();
        Long total = countQuery.getSingleResult();
        return new PageImpl<>(content, pageable, total == null ? 0 : total);
    }
}
