/*
 * どこで: Email 配信サービス層
 * 何を: 配信要求をキューへ投入できなかったことを表現する
 * なぜ: API 層で 503 へ変換するため
 */
package com.example.email.service;

public class QueueUnavailableException extends RuntimeException {

  public QueueUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
