package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.dto.CouponRequest;
import com.cred.freestyle.commerce.api.dto.CouponResponse;
import com.cred.freestyle.commerce.api.dto.PageResponse;
import com.cred.freestyle.commerce.domain.model.Coupon;
import com.cred.freestyle.commerce.service.CouponService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * Coupon administration. Customers never read coupons directly; they only
 * pass a code at checkout.
 *
 * @author Commerce Platform Team
 */
@RestController
@RequestMapping("/api/v1/admin/coupons")
@PreAuthorize("hasRole('ADMIN')")
public class CouponController {

    private static final Logger logger = LoggerFactory.getLogger(CouponController.class);

    private final CouponService couponService;

    public CouponController(CouponService couponService) {
        this.couponService = couponService;
    }

    @PostMapping
    public ResponseEntity<CouponResponse> createCoupon(@Valid @RequestBody CouponRequest request) {
        Coupon coupon = couponService.createCoupon(request.toCoupon());
        logger.info("Coupon {} created", coupon.getCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(CouponResponse.fromEntity(coupon));
    }

    @PutMapping("/{couponId}")
    public ResponseEntity<CouponResponse> updateCoupon(
            @PathVariable String couponId,
            @Valid @RequestBody CouponRequest request
    ) {
        return ResponseEntity.ok(CouponResponse.fromEntity(couponService.updateCoupon(couponId, request.toCoupon())));
    }

    @DeleteMapping("/{couponId}")
    public ResponseEntity<Void> deactivateCoupon(@PathVariable String couponId) {
        couponService.deactivateCoupon(couponId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{couponId}")
    public ResponseEntity<CouponResponse> getCoupon(@PathVariable String couponId) {
        return ResponseEntity.ok(CouponResponse.fromEntity(couponService.getCoupon(couponId)));
    }

    @GetMapping
    public ResponseEntity<PageResponse<CouponResponse>> listCoupons(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                couponService.listCoupons(Pagination.of(page, size)), CouponResponse::fromEntity));
    }
}
