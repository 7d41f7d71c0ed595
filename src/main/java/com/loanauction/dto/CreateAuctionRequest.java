package com.loanauction.dto;

import com.loanauction.model.AuctionParameters;
import com.loanauction.model.AuctionType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Request body for creating an auction. Times are ISO-8601 with an offset
 * and are compared as instants.
 */
@Getter
@Setter
@NoArgsConstructor
public class CreateAuctionRequest {

    private String loanReference;
    private String loanName;
    private AuctionType auctionType;
    private BigDecimal lotSize;
    private BigDecimal minBid;
    private BigDecimal bidIncrement;
    private BigDecimal reservePrice;
    private OffsetDateTime startTime;
    private OffsetDateTime endTime;
    private Integer durationHours;
    private String createdBy;

    public AuctionParameters toParameters() {
        return AuctionParameters.builder()
                .loanReference(loanReference)
                .loanName(loanName)
                .auctionType(auctionType)
                .lotSize(lotSize)
                .minBid(minBid)
                .bidIncrement(bidIncrement)
                .reservePrice(reservePrice)
                .startTime(startTime != null ? startTime.toInstant() : null)
                .endTime(endTime != null ? endTime.toInstant() : null)
                .durationHours(durationHours)
                .createdBy(createdBy)
                .build();
    }
}
