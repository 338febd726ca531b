package com.anime.library.catalog.service;

import com.anime.library.catalog.model.AnimeSite;
import com.anime.library.catalog.model.SiteLinkResult;
import com.anime.library.catalog.model.SiteRef;
import com.anime.library.catalog.repository.AnimeSiteRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

@Slf4j
@Service
public class AnimeSiteService {
    private final AnimeSiteRepository animeSiteRepository;
    private final TransactionTemplate transactionTemplate;

    public AnimeSiteService(AnimeSiteRepository animeSiteRepository,
                            PlatformTransactionManager transactionManager) {
        this.animeSiteRepository = animeSiteRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Attaches a site to an anime, keyed by {@code (siteId, siteType)}. When the site already
     * exists its owner is kept, even if it belongs to a different anime.
     *
     * @throws IllegalArgumentException when the reference has no type or a blank id
     */
    public SiteLinkResult linkSite(Long animeId, SiteRef ref) {
        if (ref == null || ref.siteType() == null || ref.siteId() == null || ref.siteId().isBlank()) {
            throw new IllegalArgumentException("Site reference needs a type and an id: " + ref);
        }
        String siteId = ref.siteId().trim();

        Optional<AnimeSite> existing = animeSiteRepository.findBySiteIdAndSiteType(siteId, ref.siteType());
        if (existing.isPresent()) {
            return alreadyLinked(animeId, existing.get());
        }

        try {
            AnimeSite created = transactionTemplate.execute(status ->
                    animeSiteRepository.save(new AnimeSite(animeId, ref.siteType(), siteId)));
            return new SiteLinkResult(created, true);
        } catch (DataIntegrityViolationException ex) {
            // lost an insert race; the row that won keeps its owner
            AnimeSite winner = animeSiteRepository.findBySiteIdAndSiteType(siteId, ref.siteType())
                    .orElseThrow(() -> ex);
            return alreadyLinked(animeId, winner);
        }
    }

    private SiteLinkResult alreadyLinked(Long animeId, AnimeSite site) {
        if (site.getAnimeId() != null && !site.getAnimeId().equals(animeId)) {
            log.warn("{} {} already linked to animeId={}, not moving it to animeId={}",
                    site.getSiteType(), site.getSiteId(), site.getAnimeId(), animeId);
        }
        return new SiteLinkResult(site, false);
    }
}
