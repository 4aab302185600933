/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.autopilot.api.types.ImagePlacementType;
import villagecompute.autopilot.data.models.ProductImage;

/**
 * {@link ImageStore} and {@link ImagePlacementStore} backed by the {@link ProductImage} Panache entity.
 */
@ApplicationScoped
public class PanacheImageStore implements ImageStore, ImagePlacementStore {

    private static final Logger LOG = Logger.getLogger(PanacheImageStore.class);

    @Override
    public List<ProductImage> fetchImages(UUID productId) {
        return ProductImage.findByProductId(productId);
    }

    @Override
    public List<ImagePlacementType> findPlacements(Collection<UUID> imageIds) {
        if (imageIds.isEmpty()) {
            return List.of();
        }
        List<ImagePlacementType> placements = new ArrayList<>();
        for (ProductImage image : ProductImage.findByIds(imageIds)) {
            placements.add(new ImagePlacementType(image.id, image.productId, image.position));
        }
        return placements;
    }

    @Override
    @Transactional
    public boolean restorePlacement(ImagePlacementType placement) {
        ProductImage image = ProductImage.findById(placement.imageId());
        if (image == null) {
            LOG.debugf("Image %s no longer exists, placement not restored", placement.imageId());
            return false;
        }
        image.productId = placement.previousProductId();
        image.position = placement.previousPosition();
        return true;
    }
}
