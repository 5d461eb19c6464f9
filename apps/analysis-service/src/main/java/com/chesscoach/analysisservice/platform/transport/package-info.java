/**
 * 通信协议适配层，消息结构和规范。
 * 它是"网络传输"与"分析逻辑"之间的桥梁层：定义服务器推送给客户端的消息外壳，
 * 但不关心具体的业务逻辑（引擎、棋谱、评分都不管）。
 *
 * [前端 / 客户端]  <---- WebSocket / HTTP JSON ---->  [transport 层]
 *         ↓
 *         [service 应用层]
 *         ↓
 *         [rule / engine / model]
 */
package com.chesscoach.analysisservice.platform.transport;
