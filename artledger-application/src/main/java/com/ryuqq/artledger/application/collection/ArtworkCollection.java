package com.ryuqq.artledger.application.collection;

import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;

/**
 * 작품 컬렉션의 공개 연산.
 *
 * <p>호출자 identity는 실행 호스트가 제공하며 모든 변경 연산의 첫 번째 인자로 전달됩니다.
 * 실패는 {@link com.ryuqq.artledger.core.error.LedgerException}으로 전파되고,
 * 실패한 호출은 어떤 상태도 남기지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TokenId id = collection.mint(alice);             // TokenId{1}
 * collection.approve(alice, bob, id);
 * collection.transferFrom(bob, alice, carol, id);  // 위임자로서 전송
 * collection.getApproved(id);                      // Identity.NULL
 * String uri = collection.tokenURI(id);            // data:application/json;utf8,{...}
 * </pre>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public interface ArtworkCollection {

    /**
     * 컬렉션 이름.
     */
    String name();

    /**
     * 컬렉션 심볼.
     */
    String symbol();

    /**
     * 새 자산을 caller 소유로 발행.
     *
     * @return 할당된 식별자 (1부터 순차)
     */
    TokenId mint(Identity caller);

    long balanceOf(Identity owner);

    Identity ownerOf(TokenId tokenId);

    /**
     * @return 위임자, 없으면 {@link Identity#NULL}
     */
    Identity getApproved(TokenId tokenId);

    boolean isApprovedForAll(Identity owner, Identity operator);

    void approve(Identity caller, Identity to, TokenId tokenId);

    void setApprovalForAll(Identity caller, Identity operator, boolean approved);

    void transferFrom(Identity caller, Identity from, Identity to, TokenId tokenId);

    void safeTransferFrom(Identity caller, Identity from, Identity to, TokenId tokenId);

    void safeTransferFrom(Identity caller, Identity from, Identity to, TokenId tokenId, byte[] data);

    /**
     * 메타데이터 문서. 호출마다 현재 엔트로피로 새로 계산됩니다.
     *
     * @return {@code data:application/json;utf8,...}
     * @throws com.ryuqq.artledger.core.error.LedgerException NOT_FOUND - 발행되지 않은 자산
     */
    String tokenURI(TokenId tokenId);

    long totalSupply();

    boolean exists(TokenId tokenId);
}
