package com.givehub.backend.modules.campaign.infrastructure.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.givehub.backend.modules.campaign.domain.Campaign;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.util.StringUtils;

public class CampaignRepositoryImpl implements CampaignRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<Campaign> search(CampaignSearchCondition condition, Pageable pageable) {
        StringBuilder where = new StringBuilder(" where 1 = 1");
        List<Object[]> params = new ArrayList<>();

        if (condition.ownerId() != null) {
            where.append(" and c.owner.id = :ownerId");
            params.add(new Object[]{"ownerId", condition.ownerId()});
        }
        if (condition.approved() != null) {
            where.append(" and c.approved = :approved");
            params.add(new Object[]{"approved", condition.approved()});
        }
        if (condition.closed() != null) {
            where.append(" and c.closed = :closed");
            params.add(new Object[]{"closed", condition.closed()});
        }
        if (StringUtils.hasText(condition.search())) {
            where.append(" and lower(c.title) like :search escape '\\'");
            params.add(new Object[]{"search", "%" + escapeLike(condition.search().trim().toLowerCase(Locale.ROOT)) + "%"});
        }

        TypedQuery<Campaign> query = entityManager.createQuery(
                "select c from Campaign c join fetch c.owner" + where + " order by c.createdAt desc, c.id desc",
                Campaign.class);
        TypedQuery<Long> countQuery = entityManager.createQuery(
                "select count(c) from Campaign c" + where, Long.class);
        for (Object[] param : params) {
            query.setParameter((String) param[0], param[1]);
            countQuery.setParameter((String) param[0], param[1]);
        }

        query.setFirstResult(Math.toIntExact(pageable.getOffset()));
        query.setMaxResults(pageable.getPageSize());

        List<Campaign> content = query.getResultList();
        Long total = countQuery.getSingleResult();
        return new PageImpl<>(content, pageable, total == null ? 0 : total);
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
