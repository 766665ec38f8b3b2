package com.example.identity.service;

import java.util.Locale;

/** Linker が観測に対して行った操作。 */
public enum LinkAction {
  /** 一致なし。新しい primary を作成した。 */
  CREATED_PRIMARY,
  /** 同じ email / phoneNumber の組が既にあり、何も変更していない。 */
  ALREADY_KNOWN,
  /** 既存グループへ secondary を追加した。 */
  ATTACHED_SECONDARY,
  /** 2 つのグループを古い primary 側へ統合した。 */
  MERGED;

  public String metricTag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
