package com.linlay.citygeo.geo;

import java.util.Map;

/**
 * Nominatim cannot search Chinese input reliably, but it renders localized output fine.
 * Well-known city names are swapped for an English/pinyin token before the search.
 */
public final class ChineseQueryTranslator {

    private static final Map<String, String> CITY_MAP = Map.ofEntries(
            // municipalities
            Map.entry("北京", "beijing"),
            Map.entry("上海", "shanghai"),
            Map.entry("天津", "tianjin"),
            Map.entry("重庆", "chongqing"),
            // provincial capitals and regional centres
            Map.entry("长春", "changchun"),
            Map.entry("哈尔滨", "harbin"),
            Map.entry("沈阳", "shenyang"),
            Map.entry("大连", "dalian"),
            Map.entry("石家庄", "shijiazhuang"),
            Map.entry("太原", "taiyuan"),
            Map.entry("呼和浩特", "hohhot"),
            Map.entry("济南", "jinan"),
            Map.entry("青岛", "qingdao"),
            Map.entry("郑州", "zhengzhou"),
            Map.entry("武汉", "wuhan"),
            Map.entry("长沙", "changsha"),
            Map.entry("南京", "nanjing"),
            Map.entry("杭州", "hangzhou"),
            Map.entry("合肥", "hefei"),
            Map.entry("南昌", "nanchang"),
            Map.entry("福州", "fuzhou"),
            Map.entry("厦门", "xiamen"),
            Map.entry("广州", "guangzhou"),
            Map.entry("深圳", "shenzhen"),
            Map.entry("东莞", "dongguan"),
            Map.entry("珠海", "zhuhai"),
            Map.entry("佛山", "foshan"),
            Map.entry("南宁", "nanning"),
            Map.entry("海口", "haikou"),
            Map.entry("成都", "chengdu"),
            Map.entry("贵阳", "guiyang"),
            Map.entry("昆明", "kunming"),
            Map.entry("拉萨", "lhasa"),
            Map.entry("西安", "xian"),
            Map.entry("兰州", "lanzhou"),
            Map.entry("西宁", "xining"),
            Map.entry("银川", "yinchuan"),
            Map.entry("乌鲁木齐", "urumqi"),
            // other major cities
            Map.entry("苏州", "suzhou"),
            Map.entry("无锡", "wuxi"),
            Map.entry("常州", "changzhou"),
            Map.entry("宁波", "ningbo"),
            Map.entry("温州", "wenzhou"),
            Map.entry("嘉兴", "jiaxing"),
            Map.entry("烟台", "yantai"),
            Map.entry("潍坊", "weifang"),
            Map.entry("淄博", "zibo"),
            Map.entry("威海", "weihai"),
            Map.entry("洛阳", "luoyang"),
            Map.entry("开封", "kaifeng"),
            Map.entry("唐山", "tangshan"),
            Map.entry("秦皇岛", "qinhuangdao"),
            Map.entry("包头", "baotou"),
            Map.entry("鞍山", "anshan"),
            Map.entry("抚顺", "fushun"),
            Map.entry("吉林", "jilin city"),
            Map.entry("齐齐哈尔", "qiqihar"),
            Map.entry("大庆", "daqing"),
            Map.entry("牡丹江", "mudanjiang"),
            Map.entry("佳木斯", "jiamusi"),
            Map.entry("徐州", "xuzhou"),
            Map.entry("连云港", "lianyungang"),
            Map.entry("扬州", "yangzhou"),
            Map.entry("镇江", "zhenjiang"),
            Map.entry("绍兴", "shaoxing"),
            Map.entry("台州", "taizhou"),
            Map.entry("金华", "jinhua"),
            Map.entry("衢州", "quzhou"),
            Map.entry("芜湖", "wuhu"),
            Map.entry("蚌埠", "bengbu"),
            Map.entry("马鞍山", "maanshan"),
            Map.entry("安庆", "anqing"),
            Map.entry("泉州", "quanzhou"),
            Map.entry("漳州", "zhangzhou"),
            Map.entry("莆田", "putian"),
            Map.entry("三明", "sanming"),
            Map.entry("九江", "jiujiang"),
            Map.entry("景德镇", "jingdezhen"),
            Map.entry("赣州", "ganzhou"),
            Map.entry("汕头", "shantou"),
            Map.entry("惠州", "huizhou"),
            Map.entry("中山", "zhongshan"),
            Map.entry("江门", "jiangmen"),
            Map.entry("桂林", "guilin"),
            Map.entry("柳州", "liuzhou"),
            Map.entry("北海", "beihai"),
            Map.entry("三亚", "sanya"),
            Map.entry("绵阳", "mianyang"),
            Map.entry("宜宾", "yibin"),
            Map.entry("泸州", "luzhou"),
            Map.entry("遵义", "zunyi"),
            Map.entry("曲靖", "qujing"),
            Map.entry("玉溪", "yuxi"),
            Map.entry("咸阳", "xianyang"),
            Map.entry("宝鸡", "baoji"),
            Map.entry("延安", "yanan"),
            Map.entry("天水", "tianshui"),
            Map.entry("白银", "baiyin"),
            // Hong Kong, Macau, Taiwan
            Map.entry("香港", "hong kong"),
            Map.entry("澳门", "macau"),
            Map.entry("台北", "taipei"),
            Map.entry("高雄", "kaohsiung"),
            Map.entry("台中", "taichung"),
            Map.entry("台南", "tainan"),
            Map.entry("新北", "new taipei city"),
            // international
            Map.entry("纽约", "new york"),
            Map.entry("洛杉矶", "los angeles"),
            Map.entry("旧金山", "san francisco"),
            Map.entry("芝加哥", "chicago"),
            Map.entry("伦敦", "london"),
            Map.entry("巴黎", "paris"),
            Map.entry("东京", "tokyo"),
            Map.entry("首尔", "seoul"),
            Map.entry("新加坡", "singapore"),
            Map.entry("悉尼", "sydney"),
            Map.entry("墨尔本", "melbourne"),
            Map.entry("温哥华", "vancouver"),
            Map.entry("多伦多", "toronto"),
            Map.entry("柏林", "berlin"),
            Map.entry("莫斯科", "moscow"),
            Map.entry("迪拜", "dubai"),
            Map.entry("曼谷", "bangkok"),
            Map.entry("吉隆坡", "kuala lumpur")
    );

    private ChineseQueryTranslator() {
    }

    public static String translate(String query) {
        if (query == null) {
            return null;
        }
        String mapped = CITY_MAP.get(query);
        return mapped == null ? query : mapped;
    }

    public static boolean containsHan(String text) {
        if (text == null) {
            return false;
        }
        return text.codePoints()
                .anyMatch(codePoint -> Character.UnicodeScript.of(codePoint) == Character.UnicodeScript.HAN);
    }
}
